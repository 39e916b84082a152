package analysis.symbolic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import util.Logger;
import ast.Expr;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;

/**
 * Solver backed by Z3. Symbols are 64-bit bit-vectors and arithmetic is signed and wrapping, so a model satisfies a
 * constraint exactly when the constraint evaluates to true on longs. Division and remainder are corrected from Z3's
 * truncating operators to the Euclidean ones of {@link ast.Arithmetic}.
 */
public class Z3Solver implements ConstraintSolver {

    private static final int WIDTH = 64;

    /**
     * determines printing volume
     */
    private int outputLevel = 0;

    @Override
    public SolverSession openSession(long queryTimeoutMillis) {
        return new Z3Session(queryTimeoutMillis);
    }

    @Override
    public String getName() {
        return "z3";
    }

    /**
     * Set the level of console output, higher means more output
     *
     * @param outputLevel
     *            new output level
     */
    public void setOutputLevel(int outputLevel) {
        this.outputLevel = outputLevel;
    }

    /**
     * One Z3 context and solver, each query is checked in its own push/pop scope
     */
    private class Z3Session implements SolverSession {
        private final Context ctx;
        private final Solver solver;
        private final Map<String, BitVecExpr> symbols = new HashMap<>();
        private int queries = 0;
        private boolean closed = false;

        Z3Session(long queryTimeoutMillis) {
            this.ctx = new Context();
            this.solver = ctx.mkSolver();
            if (queryTimeoutMillis > 0) {
                Params p = ctx.mkParams();
                p.add("timeout", (int) Math.min(Integer.MAX_VALUE, queryTimeoutMillis));
                solver.setParameters(p);
            }
        }

        @Override
        public SolverResult check(List<Expr> constraints) {
            if (closed) {
                throw new IllegalStateException("Solver session is closed");
            }
            queries++;
            Set<String> names = new LinkedHashSet<>();
            List<BoolExpr> translated = new ArrayList<>();
            try {
                for (Expr c : constraints) {
                    names.addAll(c.getVariables());
                    translated.add(toBool(c));
                }
                solver.push();
                try {
                    solver.add(translated.toArray(new BoolExpr[translated.size()]));
                    Status status = solver.check();
                    if (outputLevel >= 3) {
                        Logger.println("Z3 " + status + " for " + constraints);
                    }
                    switch (status) {
                    case SATISFIABLE:
                        return SolverResult.sat(extractModel(solver.getModel(), names));
                    case UNSATISFIABLE:
                        return SolverResult.unsat();
                    default:
                        return SolverResult.unknown(solver.getReasonUnknown());
                    }
                } finally {
                    solver.pop();
                }
            } catch (Z3Exception e) {
                if (outputLevel >= 1) {
                    Logger.println("Z3 failed on " + constraints + ": " + e.getMessage());
                }
                return SolverResult.unknown(e.getMessage());
            }
        }

        private Map<String, Long> extractModel(Model model, Set<String> names) {
            Map<String, Long> values = new LinkedHashMap<>();
            for (String name : names) {
                com.microsoft.z3.Expr<BitVecSort> v = model.getConstInterp(symbol(name));
                if (v instanceof BitVecNum) {
                    // the unsigned value, its low 64 bits are the two's complement long
                    values.put(name, ((BitVecNum) v).getBigInteger().longValue());
                }
            }
            return values;
        }

        private BitVecExpr symbol(String name) {
            BitVecExpr s = symbols.get(name);
            if (s == null) {
                s = ctx.mkBVConst(name, WIDTH);
                symbols.put(name, s);
            }
            return s;
        }

        /**
         * Translate a boolean expression bottom up, operands are popped right first
         */
        private BoolExpr toBool(Expr root) {
            if (!root.isBoolean()) {
                throw new IllegalArgumentException("Not a boolean expression: " + root);
            }
            Deque<com.microsoft.z3.Expr<?>> stack = new ArrayDeque<>();
            for (Expr e : root.postorder()) {
                com.microsoft.z3.Expr<?> right = e.getKind().getArity() == 2 ? stack.pop() : null;
                com.microsoft.z3.Expr<?> left = e.getKind().getArity() >= 1 ? stack.pop() : null;
                stack.push(translate(e, left, right));
            }
            return (BoolExpr) stack.pop();
        }

        private com.microsoft.z3.Expr<?> translate(Expr e, com.microsoft.z3.Expr<?> left,
                                                   com.microsoft.z3.Expr<?> right) {
            switch (e.getKind()) {
            case BOOL_CONST:
                return ctx.mkBool(e.getBooleanValue());
            case INT_CONST:
                return ctx.mkBV(e.getValue(), WIDTH);
            case VAR:
                return symbol(e.getName());
            case NOT:
                return ctx.mkNot(bool(left));
            case AND:
                return ctx.mkAnd(bool(left), bool(right));
            case OR:
                return ctx.mkOr(bool(left), bool(right));
            case LT:
                return ctx.mkBVSLT(bv(left), bv(right));
            case LE:
                return ctx.mkBVSLE(bv(left), bv(right));
            case GT:
                return ctx.mkBVSGT(bv(left), bv(right));
            case GE:
                return ctx.mkBVSGE(bv(left), bv(right));
            case EQ:
                return ctx.mkEq(bv(left), bv(right));
            case NE:
                return ctx.mkNot(ctx.mkEq(bv(left), bv(right)));
            case NEG:
                return ctx.mkBVNeg(bv(left));
            case ADD:
                return ctx.mkBVAdd(bv(left), bv(right));
            case SUB:
                return ctx.mkBVSub(bv(left), bv(right));
            case MUL:
                return ctx.mkBVMul(bv(left), bv(right));
            case DIV:
                return euclideanDiv(bv(left), bv(right));
            case MOD:
                return ctx.mkBVSub(bv(left), ctx.mkBVMul(bv(right), euclideanDiv(bv(left), bv(right))));
            default:
                throw new IllegalArgumentException("Unknown expression kind " + e.getKind());
            }
        }

        /**
         * Truncating quotient moved one step away from zero when the truncated remainder is negative, so the
         * remainder a - b * q is never negative
         */
        private BitVecExpr euclideanDiv(BitVecExpr a, BitVecExpr b) {
            BitVecExpr zero = ctx.mkBV(0, WIDTH);
            BitVecExpr one = ctx.mkBV(1, WIDTH);
            BitVecExpr q = ctx.mkBVSDiv(a, b);
            BoolExpr negativeRemainder = ctx.mkBVSLT(ctx.mkBVSRem(a, b), zero);
            com.microsoft.z3.Expr<BitVecSort> adjusted = ctx.mkITE(ctx.mkBVSGT(b, zero), ctx.mkBVSub(q, one),
                                                                   ctx.mkBVAdd(q, one));
            return (BitVecExpr) ctx.mkITE(negativeRemainder, adjusted, q);
        }

        private BoolExpr bool(com.microsoft.z3.Expr<?> e) {
            return (BoolExpr) e;
        }

        private BitVecExpr bv(com.microsoft.z3.Expr<?> e) {
            return (BitVecExpr) e;
        }

        @Override
        public int getQueryCount() {
            return queries;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                ctx.close();
            }
        }
    }
}
