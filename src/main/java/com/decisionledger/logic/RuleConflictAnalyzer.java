package com.decisionledger.logic;

import com.decisionledger.common.CanonicalJson;
import com.decisionledger.common.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Static analysis of declarative rule sets.
 *
 * Two rules of equal priority are ambiguous when some input satisfies both and
 * their results differ: declaration order would silently decide. Overlap is
 * decided by expanding each rule into disjunctive normal form and intersecting
 * per-field value domains (numeric intervals and finite value sets). On
 * integer fields an interval is empty once it holds no whole number. Only
 * equality, range and membership operators have computable domains; a pair
 * whose overlap depends on any other operator is reported as unanalyzable and
 * left to the reviewer.
 */
@Component
public class RuleConflictAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(RuleConflictAnalyzer.class);

    private enum Overlap {
        DISJOINT,
        OVERLAP,
        UNKNOWN
    }

    public RuleAnalysis analyze(RuleSetLogic logic, Set<String> knownFields) {
        return analyze(logic, knownFields, Set.of());
    }

    /**
     * @param knownFields fields the rules may legitimately reference, or null to skip that check
     * @param integerFields fields that only ever carry whole numbers
     */
    public RuleAnalysis analyze(RuleSetLogic logic, Set<String> knownFields, Set<String> integerFields) {
        List<Rule> rules = logic.rules();
        List<RuleConflict> findings = new ArrayList<>();
        detectDuplicateIds(rules, findings);
        if (knownFields != null) {
            detectUnknownFields(rules, knownFields, findings);
        }
        detectOverlaps(rules, integerFields, findings);

        if (!findings.isEmpty()) {
            log.debug("Rule analysis produced {} finding(s): {}", findings.size(), findings);
        }
        return new RuleAnalysis(findings);
    }

    private void detectDuplicateIds(List<Rule> rules, List<RuleConflict> findings) {
        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        for (Rule rule : rules) {
            if (!seen.add(rule.ruleId()) && reported.add(rule.ruleId())) {
                findings.add(new RuleConflict(ConflictType.DUPLICATE_RULE_ID, List.of(rule.ruleId()),
                    "rule_id " + rule.ruleId() + " is declared more than once"));
            }
        }
    }

    private void detectUnknownFields(List<Rule> rules, Set<String> knownFields, List<RuleConflict> findings) {
        for (Rule rule : rules) {
            rule.conditions().stream()
                .map(Condition::field)
                .filter(field -> !knownFields.contains(field))
                .distinct()
                .forEach(field -> findings.add(new RuleConflict(ConflictType.UNKNOWN_FIELD, List.of(rule.ruleId()),
                    "rule " + rule.ruleId() + " references field " + field
                        + " which is neither an input nor a bound feature")));
        }
    }

    private void detectOverlaps(List<Rule> rules, Set<String> integerFields, List<RuleConflict> findings) {
        for (int i = 0; i < rules.size(); i++) {
            for (int j = i + 1; j < rules.size(); j++) {
                Rule first = rules.get(i);
                Rule second = rules.get(j);
                if (first.priority() != second.priority() || sameResult(first, second)) {
                    continue;
                }
                switch (overlap(first, second, integerFields)) {
                    case OVERLAP -> findings.add(new RuleConflict(ConflictType.OVERLAPPING_CONDITIONS,
                        List.of(first.ruleId(), second.ruleId()),
                        "rules " + first.ruleId() + " and " + second.ruleId() + " share priority "
                            + first.priority() + ", can both match and produce different results"));
                    case UNKNOWN -> findings.add(new RuleConflict(ConflictType.UNANALYZABLE,
                        List.of(first.ruleId(), second.ruleId()),
                        "rules " + first.ruleId() + " and " + second.ruleId() + " share priority "
                            + first.priority() + " and their overlap is unanalyzable - requires manual review"));
                    case DISJOINT -> { /* unambiguous */ }
                }
            }
        }
    }

    private boolean sameResult(Rule first, Rule second) {
        return CanonicalJson.write(first.result()).equals(CanonicalJson.write(second.result()));
    }

    private Overlap overlap(Rule first, Rule second, Set<String> integerFields) {
        boolean unknown = false;
        for (List<Condition> left : disjuncts(first)) {
            for (List<Condition> right : disjuncts(second)) {
                List<Condition> combined = Stream.concat(left.stream(), right.stream()).toList();
                Overlap result = satisfiable(combined, integerFields);
                if (result == Overlap.OVERLAP) {
                    return Overlap.OVERLAP;
                }
                unknown |= result == Overlap.UNKNOWN;
            }
        }
        return unknown ? Overlap.UNKNOWN : Overlap.DISJOINT;
    }

    private List<List<Condition>> disjuncts(Rule rule) {
        if (rule.combinator() == Combinator.ALL) {
            return List.of(rule.conditions());
        }
        return rule.conditions().stream().map(List::of).toList();
    }

    private Overlap satisfiable(List<Condition> conjunction, Set<String> integerFields) {
        Map<String, FieldDomain> domains = new LinkedHashMap<>();
        boolean unanalyzable = false;
        for (Condition condition : conjunction) {
            if (!isAnalyzable(condition)) {
                unanalyzable = true;
                continue;
            }
            domains.computeIfAbsent(condition.field(), f -> new FieldDomain(integerFields.contains(f)))
                .restrict(condition);
        }
        if (domains.values().stream().anyMatch(FieldDomain::isEmpty)) {
            return Overlap.DISJOINT;
        }
        return unanalyzable ? Overlap.UNKNOWN : Overlap.OVERLAP;
    }

    private boolean isAnalyzable(Condition condition) {
        Operator operator = condition.operator();
        return operator.isAnalyzable() && (!operator.isRange() || condition.value() instanceof Number);
    }

    /**
     * Values a single field may take under a conjunction of conditions.
     */
    private static final class FieldDomain {

        private final boolean integral;
        private BigDecimal lower;
        private boolean lowerInclusive;
        private BigDecimal upper;
        private boolean upperInclusive;
        private List<Object> allowed;

        FieldDomain(boolean integral) {
            this.integral = integral;
        }

        void restrict(Condition condition) {
            switch (condition.operator()) {
                case EQ -> intersect(Collections.singletonList(condition.value()));
                case IN -> intersect((List<?>) condition.value());
                case GT -> raiseLower(number(condition), false);
                case GE -> raiseLower(number(condition), true);
                case LT -> lowerUpper(number(condition), false);
                case LE -> lowerUpper(number(condition), true);
                default -> throw new IllegalStateException("operator has no static domain: " + condition.operator());
            }
        }

        boolean isEmpty() {
            if (allowed != null) {
                return allowed.stream().noneMatch(this::admits);
            }
            if (lower == null || upper == null) {
                return false;
            }
            if (integral) {
                return smallestWhole().compareTo(largestWhole()) > 0;
            }
            int cmp = lower.compareTo(upper);
            return cmp > 0 || (cmp == 0 && !(lowerInclusive && upperInclusive));
        }

        private void intersect(Collection<?> values) {
            if (allowed == null) {
                allowed = new ArrayList<>(values);
            } else {
                allowed = new ArrayList<>(allowed.stream()
                    .filter(a -> values.stream().anyMatch(v -> Values.looselyEqual(a, v)))
                    .toList());
            }
        }

        private void raiseLower(BigDecimal bound, boolean inclusive) {
            if (lower == null || bound.compareTo(lower) > 0) {
                lower = bound;
                lowerInclusive = inclusive;
            } else if (bound.compareTo(lower) == 0) {
                lowerInclusive = lowerInclusive && inclusive;
            }
        }

        private void lowerUpper(BigDecimal bound, boolean inclusive) {
            if (upper == null || bound.compareTo(upper) < 0) {
                upper = bound;
                upperInclusive = inclusive;
            } else if (bound.compareTo(upper) == 0) {
                upperInclusive = upperInclusive && inclusive;
            }
        }

        private BigDecimal smallestWhole() {
            BigDecimal ceiling = lower.setScale(0, RoundingMode.CEILING);
            return !lowerInclusive && ceiling.compareTo(lower) == 0 ? ceiling.add(BigDecimal.ONE) : ceiling;
        }

        private BigDecimal largestWhole() {
            BigDecimal floor = upper.setScale(0, RoundingMode.FLOOR);
            return !upperInclusive && floor.compareTo(upper) == 0 ? floor.subtract(BigDecimal.ONE) : floor;
        }

        private boolean admits(Object value) {
            if (integral && value instanceof Number number
                && Values.toBigDecimal(number).stripTrailingZeros().scale() > 0) {
                return false;
            }
            return withinBounds(value);
        }

        private boolean withinBounds(Object value) {
            if (lower == null && upper == null) {
                return true;
            }
            if (!(value instanceof Number number)) {
                return false;
            }
            BigDecimal v = Values.toBigDecimal(number);
            if (lower != null) {
                int cmp = v.compareTo(lower);
                if (cmp < 0 || (cmp == 0 && !lowerInclusive)) {
                    return false;
                }
            }
            if (upper != null) {
                int cmp = v.compareTo(upper);
                if (cmp > 0 || (cmp == 0 && !upperInclusive)) {
                    return false;
                }
            }
            return true;
        }

        private static BigDecimal number(Condition condition) {
            return Values.toBigDecimal((Number) condition.value());
        }
    }
}
