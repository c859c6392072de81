package io.github.eutro.mir2cfim.test;

import io.github.eutro.mir2cfim.core.im.Block;
import io.github.eutro.mir2cfim.core.im.BlockGraph;
import io.github.eutro.mir2cfim.core.im.Terminator;
import io.github.eutro.mir2cfim.core.values.IntegerTy;
import io.github.eutro.mir2cfim.core.values.ScalarValue;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

import static io.github.eutro.mir2cfim.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class BlockGraphTest {
    @Test
    void testSuccessorsFollowTargets() {
        BlockGraph graph = BlockGraph.builder()
                .add(0, Terminator.switchInt(IntegerTy.U32, cond(0), cases(2, 1), bb(2)))
                .add(1, Terminator.ret())
                .add(2, Terminator.abort())
                .build();
        assertEquals(bb(0), graph.getEntry());
        assertEquals(Arrays.asList(bb(2), bb(1), bb(2)), graph.successors(bb(0)));
        assertEquals(Collections.emptyList(), graph.successors(bb(1)));
        assertEquals(3, graph.size());
    }

    @Test
    void testExplicitEntry() {
        BlockGraph graph = BlockGraph.builder()
                .add(new Block(bb(3), Collections.emptyList(), Terminator.ret()))
                .add(7, Terminator.goTo(bb(3)))
                .setEntry(bb(7))
                .build();
        assertEquals(bb(7), graph.getEntry());
    }

    @Test
    void testMissingEntry() {
        assertThrows(IllegalStateException.class, () -> BlockGraph.builder().build());
        assertThrows(IllegalStateException.class, () -> BlockGraph.builder()
                .add(0, Terminator.ret())
                .setEntry(bb(1))
                .build());
    }

    @Test
    void testDanglingTarget() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> BlockGraph.builder()
                .add(0, Terminator.goTo(bb(1)))
                .build());
        assertEquals("bb0 jumps to missing block bb1", e.getMessage());
    }

    @Test
    void testDuplicateBlock() {
        assertThrows(IllegalArgumentException.class, () -> BlockGraph.builder()
                .add(0, Terminator.ret())
                .add(0, Terminator.abort()));
    }

    @Test
    void testMisplacedNop() {
        assertThrows(IllegalStateException.class, () -> BlockGraph.builder()
                .add(0, Terminator.goTo(bb(1)))
                .add(1, Terminator.nop())
                .build());
        assertThrows(IllegalStateException.class, () -> BlockGraph.builder()
                .add(0, Terminator.nop())
                .add(1, Terminator.goTo(bb(0)))
                .build());
    }

    @Test
    void testUnknownBlock() {
        BlockGraph graph = BlockGraph.builder().add(0, Terminator.ret()).build();
        assertThrows(IllegalArgumentException.class, () -> graph.get(bb(5)));
    }

    @Test
    void testScalarRange() {
        assertEquals(ScalarValue.of(IntegerTy.U8, 255), ScalarValue.of(IntegerTy.U8, BigInteger.valueOf(255)));
        assertThrows(IllegalArgumentException.class, () -> ScalarValue.of(IntegerTy.U8, 256));
        assertThrows(IllegalArgumentException.class, () -> ScalarValue.of(IntegerTy.I8, -129));
        assertEquals("-128 : i8", ScalarValue.of(IntegerTy.I8, -128).toString());
    }
}
