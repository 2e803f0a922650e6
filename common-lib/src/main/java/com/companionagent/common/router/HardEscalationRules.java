package com.companionagent.common.router;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Non-negotiable pattern table that forces the highest route tier.
 *
 * <p>Groups are evaluated in order temporal, financial, weather, travel, realtime, location
 * against the lower-cased, trimmed message; every match is reported as
 * {@code category:label}. Short greetings and farewells are exempt so that
 * "how are you today" does not escalate on "today".
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class HardEscalationRules {

    public enum Category {
        TEMPORAL, FINANCIAL, WEATHER, TRAVEL, REALTIME, LOCATION;

        String tag() {
            return name().toLowerCase();
        }
    }

    /** Matches of one message; {@code category} is the first group that matched. */
    public record EscalationResult(boolean triggered, List<String> matchedPatterns, Category category) {}

    private record Group(Category category, List<LabeledPattern> patterns) {}

    private static final List<Group> GROUPS = List.of(
        new Group(Category.TEMPORAL, List.of(
            LabeledPattern.of("\\b(today|tonight|this\\s+morning|this\\s+afternoon|this\\s+evening)\\b", "today"),
            LabeledPattern.of("\\b(tomorrow|next\\s+week|next\\s+month|this\\s+weekend)\\b", "near_future"),
            LabeledPattern.of("\\b(now|right\\s+now|at\\s+the\\s+moment|currently)\\b", "now"),
            LabeledPattern.of("\\b(current|latest|recent|new|updated)\\b", "current"),
            LabeledPattern.of("\\b(yesterday|last\\s+night|earlier\\s+today)\\b", "recent_past"),
            LabeledPattern.of("\\b(what\\s+time|when\\s+is|what\\s+day)\\b", "time_query"),
            LabeledPattern.of("\\b(open|closed|hours|available)\\s+(now|today|right\\s+now)", "availability"))),
        new Group(Category.FINANCIAL, List.of(
            LabeledPattern.of("\\b(price|cost|how\\s+much|pricing)\\b", "price"),
            LabeledPattern.of("\\$[\\d,]+(\\.\\d{2})?", "dollar_amount"),
            LabeledPattern.of("\\b(stock|stocks|share|shares|equity|equities)\\b", "stocks"),
            LabeledPattern.of("\\b(crypto|bitcoin|btc|ethereum|eth|coin|token)\\b", "crypto"),
            LabeledPattern.of("\\b(trading|trade|buy|sell|invest|investment)\\b", "trading"),
            LabeledPattern.of("\\b(market|nasdaq|nyse|dow|s&p|sp500)\\b", "market"),
            LabeledPattern.of("\\b(exchange\\s+rate|forex|currency|usd|eur|gbp)\\b", "forex"),
            LabeledPattern.of("\\b(portfolio|holdings|balance|account\\s+value)\\b", "portfolio"))),
        new Group(Category.WEATHER, List.of(
            LabeledPattern.of("\\b(weather|forecast|temperature|temp)\\b", "weather"),
            LabeledPattern.of("\\b(rain|raining|rainy|snow|snowing|sunny|cloudy|storm)\\b", "conditions"),
            LabeledPattern.of("\\b(degrees|celsius|fahrenheit|humidity)\\b", "metrics"),
            LabeledPattern.of("\\b(will\\s+it\\s+rain|is\\s+it\\s+going\\s+to|should\\s+i\\s+bring)\\b", "weather_query"))),
        new Group(Category.TRAVEL, List.of(
            LabeledPattern.of("\\b(flight|flights|airline|plane|airport)\\b", "flight"),
            LabeledPattern.of("\\b(booking|book|reserve|reservation)\\b", "booking"),
            LabeledPattern.of("\\b(schedule|departure|arrival|gate|terminal)\\b", "schedule"),
            LabeledPattern.of("\\b(availability|available|seat|seats)\\b", "availability"),
            LabeledPattern.of("\\b(ticket|tickets|fare|fares)\\b", "tickets"),
            LabeledPattern.of("\\b(hotel|motel|accommodation|lodging|airbnb)\\b", "lodging"),
            LabeledPattern.of("\\b(train|bus|subway|metro|transit)\\b", "transit"),
            LabeledPattern.of("\\b(traffic|delay|delays|delayed|on\\s+time)\\b", "traffic"))),
        new Group(Category.REALTIME, List.of(
            LabeledPattern.of("\\b(live|real-?time|happening|breaking)\\b", "live"),
            LabeledPattern.of("\\b(news|headlines|latest\\s+news)\\b", "news"),
            LabeledPattern.of("\\b(score|scores|game|match|playing)\\b", "sports"),
            LabeledPattern.of("\\b(status|update|updates)\\b", "status"),
            LabeledPattern.of("\\b(trending|viral|popular\\s+right\\s+now)\\b", "trending"))),
        new Group(Category.LOCATION, List.of(
            LabeledPattern.of("\\b(near\\s+me|nearby|closest|nearest)\\b", "nearby"),
            LabeledPattern.of("\\b(directions|how\\s+to\\s+get\\s+to|route\\s+to|navigate)\\b", "directions"),
            LabeledPattern.of("\\b(open\\s+now|is\\s+.+\\s+open|are\\s+.+\\s+open)\\b", "hours"),
            LabeledPattern.of("\\b(where\\s+is|where\\s+can\\s+i|find\\s+a|find\\s+the)\\b", "location_query")))
    );

    private static final List<Pattern> GREETINGS = List.of(
        LabeledPattern.compile("^(hi|hello|hey|good\\s+(morning|afternoon|evening)|what'?s\\s+up|how\\s+are\\s+you)"),
        LabeledPattern.compile("^(thanks|thank\\s+you|bye|goodbye|see\\s+you)")
    );

    private static final int GREETING_MAX_LENGTH = 50;

    private HardEscalationRules() {}

    /** Runs the full table, ignoring the greeting exemption. */
    public static EscalationResult check(String message) {
        String normalized = message.toLowerCase().trim();
        List<String> matched = new ArrayList<>();
        Category first = null;

        for (Group group : GROUPS) {
            for (LabeledPattern p : group.patterns()) {
                if (p.matches(normalized)) {
                    matched.add(group.category().tag() + ":" + p.label());
                    if (first == null) first = group.category();
                }
            }
        }
        return new EscalationResult(!matched.isEmpty(), List.copyOf(matched), first);
    }

    /** Short message that opens with a greeting or a farewell. */
    public static boolean isPrimaryGreeting(String message) {
        String trimmed = message.trim();
        if (trimmed.length() >= GREETING_MAX_LENGTH) return false;
        for (Pattern p : GREETINGS) {
            if (p.matcher(trimmed).find()) return true;
        }
        return false;
    }

    /**
     * @return the escalation when the message must go to the highest tier, or {@code null}
     *         when it is a greeting or nothing matched
     */
    public static EscalationResult shouldEscalate(String message) {
        if (isPrimaryGreeting(message)) return null;
        EscalationResult result = check(message);
        return result.triggered() ? result : null;
    }
}
