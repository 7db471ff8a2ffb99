package com.example.cdscoverage.ingestion;

import com.example.cdscoverage.model.DecisionPoint;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts clinical decision points from guideline prose, such as
 * "For patients with X, recommend Y" or "Monitor patients with X for Y".
 * <p>
 * Patterns are applied in order; a sentence claimed by an earlier pattern is not extracted again
 * by a more generic one.
 */
@Service
public class DecisionPointExtractor {

    private static final int CONTEXT_CHARS = 100;

    private enum Shape {
        /** group 1 = criteria, group 2 = action */
        CRITERIA_THEN_ACTION,
        /** group 1 = action, group 2 = criteria */
        ACTION_THEN_CRITERIA,
        /** group 1 = criteria, group 2 = what to monitor */
        MONITORING
    }

    private record DecisionPattern(Pattern pattern, Shape shape) {}

    private static final List<DecisionPattern> PATTERNS = List.of(
            new DecisionPattern(compile("for patients with ([^,.]*?), recommend ([^.]*?)\\."), Shape.CRITERIA_THEN_ACTION),
            new DecisionPattern(compile("recommend ([^.]*) for patients with ([^.]*?)\\."), Shape.ACTION_THEN_CRITERIA),
            new DecisionPattern(compile("order ([^.]*) for patients with ([^.]*?)\\."), Shape.ACTION_THEN_CRITERIA),
            new DecisionPattern(compile("order ([^.]*) for ([^.]*?)\\."), Shape.ACTION_THEN_CRITERIA),
            new DecisionPattern(compile("monitor patients with ([^,.]*?) for ([^.]*?)\\."), Shape.MONITORING)
    );

    public List<DecisionPoint> extract(String text) {
        if (text == null || text.isBlank()) return List.of();

        List<DecisionPoint> decisions = new ArrayList<>();
        Set<Integer> claimedEnds = new HashSet<>();
        for (DecisionPattern decisionPattern : PATTERNS) {
            Matcher m = decisionPattern.pattern().matcher(text);
            while (m.find()) {
                if (!claimedEnds.add(m.end())) continue;
                String first = m.group(1).trim();
                String second = m.group(2).trim();
                String context = text.substring(Math.max(0, m.start() - CONTEXT_CHARS),
                        Math.min(text.length(), m.end() + CONTEXT_CHARS)).trim();
                decisions.add(switch (decisionPattern.shape()) {
                    case CRITERIA_THEN_ACTION -> new DecisionPoint(second, List.of(first), context);
                    case ACTION_THEN_CRITERIA -> new DecisionPoint(first, List.of(second), context);
                    case MONITORING -> new DecisionPoint("monitor for " + second, List.of(first), context);
                });
            }
        }
        return decisions;
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
