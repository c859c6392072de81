package io.github.eutro.mir2cfim.test;

import io.github.eutro.mir2cfim.core.cfim.Expression;
import io.github.eutro.mir2cfim.core.cfg.IrreducibleControlFlowException;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.BlockId;
import io.github.eutro.mir2cfim.core.im.Statement;
import io.github.eutro.mir2cfim.core.im.Terminator;
import io.github.eutro.mir2cfim.core.passes.meta.AnalyzeControlFlow;
import io.github.eutro.mir2cfim.core.values.FunId;
import io.github.eutro.mir2cfim.core.values.IntegerTy;
import io.github.eutro.mir2cfim.core.values.Operand;
import io.github.eutro.mir2cfim.core.values.Place;
import io.github.eutro.mir2cfim.core.values.Rvalue;
import io.github.eutro.mir2cfim.core.values.ScalarValue;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

public class Utils {
    @NotNull
    public static BlockId bb(int index) {
        return BlockId.of(index);
    }

    /**
     * A condition operand, distinct for each index.
     */
    @NotNull
    public static Operand cond(int index) {
        return Operand.copy(Place.of(100 + index));
    }

    /**
     * An assignment identifying the block it is in.
     */
    @NotNull
    public static Statement mark(int block) {
        return Statement.assign(Place.of(block), Rvalue.use(Operand.constant("bb" + block)));
    }

    /**
     * The structured counterpart of {@link #mark(int)}.
     */
    @NotNull
    public static Expression markLeaf(int block) {
        return Expression.leaf(io.github.eutro.mir2cfim.core.cfim.Statement.assign(
                Place.of(block),
                Rvalue.use(Operand.constant("bb" + block))
        ));
    }

    @NotNull
    public static Map<ScalarValue, BlockId> cases(int... targets) {
        Map<ScalarValue, BlockId> cases = new LinkedHashMap<>();
        for (int i = 0; i < targets.length; i++) {
            cases.put(ScalarValue.of(IntegerTy.U32, i), bb(targets[i]));
        }
        return cases;
    }

    /**
     * Generate a random graph, where each block is marked. It may well be irreducible.
     */
    @NotNull
    public static BlockGraph randomGraph(Random random, int size) {
        BlockGraph.Builder builder = BlockGraph.builder();
        for (int i = 0; i < size; i++) {
            Terminator term;
            switch (random.nextInt(11)) {
                case 0:
                case 1:
                case 2:
                    term = Terminator.goTo(bb(random.nextInt(size)));
                    break;
                case 3:
                case 4:
                case 5:
                    term = Terminator.ifThenElse(cond(i), bb(random.nextInt(size)), bb(random.nextInt(size)));
                    break;
                case 6:
                    term = Terminator.switchInt(IntegerTy.U32, cond(i),
                            cases(random.nextInt(size), random.nextInt(size)),
                            bb(random.nextInt(size)));
                    break;
                case 7:
                    term = Terminator.call(FunId.local(i), Collections.singletonList(cond(i)),
                            Place.of(200 + i), bb(random.nextInt(size)));
                    break;
                case 8:
                    term = Terminator.assertThat(cond(i), random.nextBoolean(), bb(random.nextInt(size)));
                    break;
                case 9:
                    term = Terminator.abort();
                    break;
                default:
                    term = Terminator.ret();
                    break;
            }
            builder.add(i, term, mark(i));
        }
        return builder.build();
    }

    public static boolean isReducible(BlockGraph graph) {
        try {
            AnalyzeControlFlow.INSTANCE.run(graph);
            return true;
        } catch (IrreducibleControlFlowException e) {
            return false;
        }
    }
}
