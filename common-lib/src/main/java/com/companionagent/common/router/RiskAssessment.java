package com.companionagent.common.router;

import com.companionagent.common.model.RiskLevel;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Estimates the cost of a wrong answer. Any high-risk signal makes the message high risk,
 * otherwise any medium signal makes it medium, otherwise it is low.
 */
public final class RiskAssessment {

    public record RiskResult(RiskLevel riskLevel, List<String> matchedPatterns) {}

    private static final List<LabeledPattern> HIGH = List.of(
        // financial
        LabeledPattern.of("\\b(buy|sell|invest|trade|transfer|send\\s+money)\\b", "financial_action"),
        LabeledPattern.of("\\b(payment|pay|wire|withdraw|deposit)\\b", "payment"),
        LabeledPattern.of("\\$\\d+", "dollar_amount"),
        LabeledPattern.of("\\b(price|cost|fee|rate)\\s+(is|for|of)\\b", "price_query"),
        LabeledPattern.of("\\b(stock|crypto|bitcoin|ethereum|trading)\\b", "trading"),
        LabeledPattern.of("\\b(portfolio|balance|account)\\b", "account"),
        // health
        LabeledPattern.of("\\b(medical|medicine|medication|drug|prescription)\\b", "medical"),
        LabeledPattern.of("\\b(symptom|symptoms|diagnosis|treatment|therapy)\\b", "health"),
        LabeledPattern.of("\\b(doctor|hospital|emergency|urgent\\s+care)\\b", "healthcare"),
        LabeledPattern.of("\\b(dosage|dose|mg|milligrams)\\b", "dosage"),
        LabeledPattern.of("\\b(side\\s+effect|interaction|allergy)\\b", "drug_safety"),
        // legal
        LabeledPattern.of("\\b(legal|lawyer|attorney|lawsuit|sue|court)\\b", "legal"),
        LabeledPattern.of("\\b(contract|agreement|liability|rights)\\b", "contract"),
        LabeledPattern.of("\\b(law|regulation|compliance|illegal)\\b", "law"),
        // travel
        LabeledPattern.of("\\b(flight|booking|reservation|ticket)\\b", "booking"),
        LabeledPattern.of("\\b(departure|arrival|gate|terminal)\\b", "travel"),
        LabeledPattern.of("\\b(hotel|room|accommodation)\\b", "lodging"),
        // safety
        LabeledPattern.of("\\b(safe|safety|dangerous|hazard|risk)\\b", "safety"),
        LabeledPattern.of("\\b(password|security|authentication|login)\\b", "security"),
        LabeledPattern.of("\\b(emergency|urgent|critical)\\b", "emergency"),
        // deadlines
        LabeledPattern.of("\\b(deadline|due\\s+date|expires|expiration)\\b", "deadline"),
        LabeledPattern.of("\\b(application|apply|submit)\\s+(by|before|deadline)", "application"),
        // navigation
        LabeledPattern.of("\\b(navigate|directions|route\\s+to)\\b", "navigation"),
        LabeledPattern.of("\\b(open|closed|hours)\\s+(today|now)", "hours")
    );

    private static final List<LabeledPattern> MEDIUM = List.of(
        LabeledPattern.of("\\b(recommend|should\\s+i|best|which\\s+one)\\b", "recommendation"),
        LabeledPattern.of("\\b(compare|comparison|versus|vs)\\b", "comparison"),
        LabeledPattern.of("\\b(pros\\s+and\\s+cons|advantages|disadvantages)\\b", "pros_cons"),
        LabeledPattern.of("\\b(schedule|appointment|meeting|calendar)\\b", "schedule"),
        LabeledPattern.of("\\b(plan|planning|itinerary)\\b", "planning"),
        LabeledPattern.of("\\b(how\\s+long|duration|time\\s+to)\\b", "duration"),
        LabeledPattern.of("\\b(install|setup|configure|implementation)\\b", "technical"),
        LabeledPattern.of("\\b(compatible|compatibility|work\\s+with)\\b", "compatibility"),
        LabeledPattern.of("\\b(requirement|requires|needed)\\b", "requirements"),
        LabeledPattern.of("\\b(is\\s+it\\s+true|fact\\s+check|accurate)\\b", "fact_check"),
        LabeledPattern.of("\\b(confirm|verify|make\\s+sure)\\b", "verification"),
        LabeledPattern.of("\\b(how\\s+to|step\\s+by\\s+step|instructions)\\b", "instructions"),
        LabeledPattern.of("\\b(tutorial|guide|walkthrough)\\b", "guide")
    );

    private static final List<LabeledPattern> LOW = List.of(
        LabeledPattern.of("^(hi|hello|hey|thanks|bye)", "greeting"),
        LabeledPattern.of("\\b(chat|talk|conversation)\\b", "chat"),
        LabeledPattern.of("\\b(opinion|think|feel|believe)\\b", "opinion"),
        LabeledPattern.of("\\b(joke|funny|humor|fun)\\b", "entertainment"),
        LabeledPattern.of("\\b(story|tale|fiction)\\b", "fiction"),
        LabeledPattern.of("\\b(game|play|trivia)\\b", "game"),
        LabeledPattern.of("\\b(write|poem|song|lyrics|creative)\\b", "creative"),
        LabeledPattern.of("\\b(brainstorm|ideas|suggestions)\\b", "brainstorm"),
        LabeledPattern.of("\\b(rewrite|rephrase|summarize|translate)\\b", "transform"),
        LabeledPattern.of("\\b(format|style|tone)\\b", "style"),
        LabeledPattern.of("\\bexplain\\s+(the\\s+)?concept", "concept"),
        LabeledPattern.of("\\b(history\\s+of|background|origin)\\b", "history"),
        LabeledPattern.of("\\b(what\\s+is|who\\s+is|define)\\b", "definition")
    );

    private static final List<Pattern> OBVIOUSLY_HIGH = List.of(
        LabeledPattern.compile("\\b(buy|sell|invest|trade|transfer|pay)\\b"),
        LabeledPattern.compile("\\b(medical|symptom|medication|dosage)\\b"),
        LabeledPattern.compile("\\b(legal|lawyer|lawsuit|contract)\\b"),
        LabeledPattern.compile("\\$\\d+")
    );

    private static final List<Pattern> OBVIOUSLY_LOW = List.of(
        LabeledPattern.compile("^(hi|hello|hey|thanks|bye|ok|okay)"),
        LabeledPattern.compile("\\b(rewrite|summarize|translate|explain\\s+the\\s+concept)\\b"),
        LabeledPattern.compile("\\b(joke|fun|creative|brainstorm)\\b")
    );

    private RiskAssessment() {}

    public static RiskResult assess(String message) {
        String normalized = message.toLowerCase().trim();

        List<String> high = FreshnessCheck.labels(normalized, HIGH);
        if (!high.isEmpty()) return new RiskResult(RiskLevel.HIGH, high);

        List<String> medium = FreshnessCheck.labels(normalized, MEDIUM);
        if (!medium.isEmpty()) return new RiskResult(RiskLevel.MEDIUM, medium);

        return new RiskResult(RiskLevel.LOW, FreshnessCheck.labels(normalized, LOW));
    }

    public static boolean obviouslyHighRisk(String message) {
        return FreshnessCheck.anyMatch(message, OBVIOUSLY_HIGH);
    }

    /** Very short messages are low risk regardless of content. */
    public static boolean obviouslyLowRisk(String message) {
        if (message.trim().length() < 15) return true;
        return FreshnessCheck.anyMatch(message, OBVIOUSLY_LOW);
    }
}
