package com.decisionflow.factoring;

import com.decisionflow.exception.FactoringException;
import com.decisionflow.expression.And;
import com.decisionflow.expression.BooleanExpr;
import com.decisionflow.expression.ExprType;
import com.decisionflow.expression.Identifier;
import com.decisionflow.expression.LogicExpressionParser;
import com.decisionflow.expression.Not;
import com.decisionflow.expression.Or;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort pre-pass that collapses and-joined OR-clauses into synthetic identifiers.
 * <p>
 * A clause is factored when it is an operand of an AND and has the exact shape
 * {@code (a or b or ...)} or {@code (not a or not b or ...)}. The clause text is
 * replaced by {@code V1}, {@code V2}, ... and a composite question is added for it.
 * Only AND/OR nesting down to {@code maxDepth} levels is inspected.
 * <p>
 * Any failure returns the input unchanged; factoring never blocks compilation.
 */
public class OrGroupFactorizer {

    private static final Logger log = LoggerFactory.getLogger(OrGroupFactorizer.class);

    public static final int DEFAULT_MAX_DEPTH = 4;
    static final String VIRTUAL_PREFIX = "V";
    static final String COMPOSITE_PREFIX = "Does patient meet either:\n";

    private final int maxDepth;

    public OrGroupFactorizer() {
        this(DEFAULT_MAX_DEPTH);
    }

    public OrGroupFactorizer(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Factor the OR-clauses of a logic text.
     *
     * @param logic     Logic text
     * @param questions Identifier to question text, left untouched
     * @return Rewritten text and questions, or the original input if nothing was factored
     */
    public FactoringResult factor(String logic, Map<String, String> questions) {
        try {
            return doFactor(logic, questions);
        } catch (RuntimeException e) {
            log.warn("OR-group factoring skipped for '{}': {}", logic, e.getMessage());
            log.debug("Factoring failure", e);
            return FactoringResult.unchanged(logic, questions);
        }
    }

    private FactoringResult doFactor(String logic, Map<String, String> questions) {
        BooleanExpr expr = LogicExpressionParser.parse(logic);

        List<Or> clauses = new ArrayList<>();
        collectClauses(expr, 1, clauses);
        if (clauses.isEmpty()) {
            return FactoringResult.unchanged(logic, questions);
        }

        Set<String> taken = new HashSet<>(expr.identifiers());
        taken.addAll(questions.keySet());

        Map<String, String> extendedQuestions = new LinkedHashMap<>(questions);
        List<FactorGroup> groups = new ArrayList<>();
        String rewritten = logic;
        int next = 1;

        for (Or clause : clauses) {
            String virtualId;
            do {
                virtualId = VIRTUAL_PREFIX + next++;
            } while (taken.contains(virtualId));
            taken.add(virtualId);

            boolean negated = clause.operands().get(0).type() == ExprType.NOT;
            List<String> members = memberNames(clause);

            rewritten = replaceClause(rewritten, members, negated, virtualId);
            extendedQuestions.put(virtualId, compositeQuestion(members, negated, questions));
            groups.add(new FactorGroup(virtualId, members, negated));

            log.debug("Factored {} into {}", clause, virtualId);
        }

        // The rewritten text must still be a valid expression
        LogicExpressionParser.parse(rewritten);

        log.info("Factored {} OR-group(s): '{}' -> '{}'", groups.size(), logic, rewritten);
        return new FactoringResult(rewritten, extendedQuestions, groups, true);
    }

    private void collectClauses(BooleanExpr expr, int depth, List<Or> clauses) {
        if (depth > maxDepth) {
            return;
        }
        if (expr instanceof And and) {
            for (BooleanExpr operand : and.operands()) {
                if (operand instanceof Or or && isFactorable(or)) {
                    clauses.add(or);
                } else {
                    collectClauses(operand, depth + 1, clauses);
                }
            }
        } else if (expr instanceof Or or) {
            for (BooleanExpr operand : or.operands()) {
                collectClauses(operand, depth + 1, clauses);
            }
        }
    }

    private boolean isFactorable(Or or) {
        boolean allIdentifiers = or.operands().stream()
                .allMatch(o -> o.type() == ExprType.IDENTIFIER);
        boolean allNegatedIdentifiers = or.operands().stream()
                .allMatch(o -> o instanceof Not not && not.operand().type() == ExprType.IDENTIFIER);
        return allIdentifiers || allNegatedIdentifiers;
    }

    private List<String> memberNames(Or clause) {
        List<String> members = new ArrayList<>(clause.operands().size());
        for (BooleanExpr operand : clause.operands()) {
            BooleanExpr target = operand instanceof Not not ? not.operand() : operand;
            members.add(((Identifier) target).name());
        }
        return members;
    }

    private String replaceClause(String logic, List<String> members, boolean negated, String virtualId) {
        StringBuilder regex = new StringBuilder("\\(\\s*");
        for (int i = 0; i < members.size(); i++) {
            if (i > 0) {
                regex.append("\\s+(?i:or)\\s+");
            }
            if (negated) {
                regex.append("(?i:not)\\s+");
            }
            regex.append(Pattern.quote(members.get(i)));
        }
        regex.append("\\s*\\)");

        Matcher matcher = Pattern.compile(regex.toString()).matcher(logic);
        if (!matcher.find()) {
            throw new FactoringException("No textual occurrence of OR-clause over " + members);
        }
        String before = logic.substring(0, matcher.start());
        String after = logic.substring(matcher.end());
        // Keep the virtual id from fusing with an adjacent keyword, e.g. "and(a or b)"
        String prefix = endsWithWordChar(before) ? " " : "";
        String suffix = startsWithWordChar(after) ? " " : "";
        return before + prefix + virtualId + suffix + after;
    }

    private boolean endsWithWordChar(String text) {
        return !text.isEmpty() && isWordChar(text.charAt(text.length() - 1));
    }

    private boolean startsWithWordChar(String text) {
        return !text.isEmpty() && isWordChar(text.charAt(0));
    }

    private boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private String compositeQuestion(List<String> members, boolean negated, Map<String, String> questions) {
        List<String> parts = new ArrayList<>();
        for (String member : members) {
            String question = questions.get(member);
            if (question != null) {
                parts.add(negated ? "NOT " + question : question);
            }
        }
        return COMPOSITE_PREFIX + String.join(" OR ", parts) + "?";
    }
}
