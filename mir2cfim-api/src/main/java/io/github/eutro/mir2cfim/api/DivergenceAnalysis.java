package io.github.eutro.mir2cfim.api;

import io.github.eutro.mir2cfim.core.cfim.Expressions;
import io.github.eutro.mir2cfim.core.cfim.FunDecl;
import io.github.eutro.mir2cfim.core.values.FunId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the declarations of a crate that might not terminate.
 * <p>
 * A declaration might diverge if its body contains a loop, if it is recursive or part of a mutually recursive
 * group, or if it calls a local declaration that might diverge. Calls to assumed functions, and to declarations
 * that are not part of the crate, are assumed to terminate.
 */
public final class DivergenceAnalysis {
    private DivergenceAnalysis() {
    }

    /**
     * Compute which declarations might diverge.
     *
     * @param decls The structured declarations of the crate.
     * @return The ids of the declarations that might diverge.
     */
    public static Set<Integer> divergent(List<FunDecl> decls) {
        Map<Integer, Integer> index = new HashMap<>();
        for (int i = 0; i < decls.size(); i++) {
            index.putIfAbsent(decls.get(i).defId, i);
        }
        int n = decls.size();
        int[][] callees = new int[n][];
        for (int i = 0; i < n; i++) {
            List<Integer> cs = new ArrayList<>();
            for (FunId callee : Expressions.collectCallees(decls.get(i).body)) {
                if (!callee.isLocal()) continue;
                Integer target = index.get(callee.getDefId());
                if (target != null) cs.add(target);
            }
            callees[i] = cs.stream().mapToInt(Integer::intValue).toArray();
        }

        /*
         Robert Tarjan. Depth-first search and linear graph algorithms.
         SIAM Journal on Computing, 1(2):146-160, 1972.

         Components are completed callees first, so divergence can be decided in one sweep.
        */
        class S {
            final int[] num = new int[n];
            final int[] low = new int[n];
            final boolean[] onStack = new boolean[n];
            final int[] stack = new int[n];
            final boolean[] diverges = new boolean[n];
            int sp = 0;
            int counter = 0;

            void visit(int v) {
                num[v] = low[v] = ++counter;
                stack[sp++] = v;
                onStack[v] = true;
                for (int w : callees[v]) {
                    if (num[w] == 0) {
                        visit(w);
                        low[v] = Math.min(low[v], low[w]);
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], num[w]);
                    }
                }
                if (low[v] == num[v]) {
                    List<Integer> component = new ArrayList<>();
                    int w;
                    do {
                        w = stack[--sp];
                        onStack[w] = false;
                        component.add(w);
                    } while (w != v);
                    completeComponent(component);
                }
            }

            void completeComponent(List<Integer> component) {
                boolean div = component.size() > 1;
                for (int v : component) {
                    if (div) break;
                    if (decls.get(v).divergent || Expressions.containsLoop(decls.get(v).body)) {
                        div = true;
                    }
                    for (int w : callees[v]) {
                        // self-recursion, or a call into an already completed divergent component
                        if (w == v || diverges[w]) {
                            div = true;
                            break;
                        }
                    }
                }
                for (int v : component) {
                    diverges[v] = div;
                }
            }
        }

        S s = new S();
        for (int i = 0; i < n; i++) {
            if (s.num[i] == 0) s.visit(i);
        }
        Set<Integer> result = new LinkedHashSet<>();
        for (int i = 0; i < n; i++) {
            if (s.diverges[i]) result.add(decls.get(i).defId);
        }
        return result;
    }
}
