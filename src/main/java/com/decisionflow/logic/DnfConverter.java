package com.decisionflow.logic;

import com.decisionflow.expression.And;
import com.decisionflow.expression.BooleanExpr;
import com.decisionflow.expression.Identifier;
import com.decisionflow.expression.Not;
import com.decisionflow.expression.Or;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts an expression tree into disjunctive normal form.
 * <p>
 * Term and literal order follow the input strictly (left to right, depth first);
 * nothing is sorted or deduplicated.
 */
public class DnfConverter {

    private static final Logger log = LoggerFactory.getLogger(DnfConverter.class);

    /**
     * Convert an expression to DNF.
     *
     * @param expr Expression, normalized or not
     * @return Equivalent DNF
     */
    public Dnf toDnf(BooleanExpr expr) {
        Dnf dnf = convert(expr);
        log.debug("Converted {} into {} DNF terms", expr, dnf.size());
        return dnf;
    }

    private Dnf convert(BooleanExpr expr) {
        return switch (expr.type()) {
            case IDENTIFIER -> Dnf.of(Term.of(Literal.positive(((Identifier) expr).name())));
            case NOT -> convertNot((Not) expr);
            case AND -> convertAnd((And) expr);
            case OR -> convertOr((Or) expr);
        };
    }

    private Dnf convertNot(Not not) {
        BooleanExpr operand = not.operand();
        if (operand instanceof Identifier identifier) {
            return Dnf.of(Term.of(Literal.negative(identifier.name())));
        }
        return negate(convert(operand));
    }

    private Dnf convertAnd(And and) {
        Dnf result = Dnf.TRUE;
        for (BooleanExpr operand : and.operands()) {
            result = distribute(result, convert(operand));
        }
        return result;
    }

    private Dnf convertOr(Or or) {
        List<Term> terms = new ArrayList<>();
        for (BooleanExpr operand : or.operands()) {
            terms.addAll(convert(operand).terms());
        }
        return new Dnf(terms);
    }

    /**
     * NOT(t1 OR t2 OR ...) = NOT t1 AND NOT t2 AND ..., where each NOT ti is the
     * disjunction of ti's negated literals; the conjunction is distributed back into DNF.
     */
    private Dnf negate(Dnf dnf) {
        Dnf result = Dnf.TRUE;
        for (Term term : dnf.terms()) {
            List<Term> negatedLiterals = new ArrayList<>(term.size());
            for (Literal literal : term.literals()) {
                negatedLiterals.add(Term.of(literal.negate()));
            }
            result = distribute(result, new Dnf(negatedLiterals));
        }
        return result;
    }

    /**
     * (a OR b) AND (c OR d) = ac OR ad OR bc OR bd
     */
    private Dnf distribute(Dnf left, Dnf right) {
        List<Term> terms = new ArrayList<>(left.size() * right.size());
        for (Term l : left.terms()) {
            for (Term r : right.terms()) {
                terms.add(l.concat(r));
            }
        }
        return new Dnf(terms);
    }
}
