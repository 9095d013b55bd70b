package io.github.eutro.funclets.test;

import io.github.eutro.funclets.bytecode.ValType;
import io.github.eutro.funclets.validate.OperandTypeStack;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.funclets.bytecode.ValType.*;
import static org.junit.jupiter.api.Assertions.*;

public class OperandTypeStackTest {
    @Test
    void testPushPop() {
        OperandTypeStack stack = new OperandTypeStack();
        stack.push(I32);
        stack.pushAll(Arrays.asList(F32, I64));
        assertEquals(3, stack.height());
        assertEquals(I64, stack.peek());
        assertEquals(I64, stack.pop());
        assertEquals(F32, stack.pop());
        assertEquals(I32, stack.pop());
        assertNull(stack.peek());
        assertThrows(IllegalStateException.class, stack::pop);
    }

    @Test
    void testMarks() {
        OperandTypeStack stack = new OperandTypeStack();
        stack.push(I32);
        int mark = stack.mark();
        stack.push(F64);
        assertEquals(F64, stack.popAbove(mark));
        assertNull(stack.popAbove(mark));
        assertEquals(1, stack.height());
    }

    @Test
    void testValuesAbove() {
        OperandTypeStack stack = new OperandTypeStack();
        stack.pushAll(Arrays.asList(I32, I64, F32));
        List<ValType> above = stack.valuesAbove(1);
        assertEquals(Arrays.asList(I64, F32), above);
        stack.truncate(1);
        assertEquals(Arrays.asList(I64, F32), above);
        assertEquals(Collections.emptyList(), stack.valuesAbove(1));
        assertEquals("[i32]", stack.toString());
        assertThrows(UnsupportedOperationException.class, () -> above.add(I32));
    }
}
