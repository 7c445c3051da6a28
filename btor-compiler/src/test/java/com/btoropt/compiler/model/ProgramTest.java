package com.btoropt.compiler.model;

import com.btoropt.compiler.error.StructuralException;
import com.btoropt.compiler.error.UnresolvedReferenceException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 程序不变量测试
 */
class ProgramTest {

    private static Module module(String name) {
        return new Module(name, Arrays.asList(Sort.bitvector(1, 1), Declaration.input(2, 1, "a")));
    }

    private static Contract contract(String name) {
        List<Instruction> body = Arrays.asList(
                Sort.bitvector(1, 1),
                new Instruction(2, Opcode.ONE, 1),
                new Instruction(3, Opcode.PREC, 2));
        return new Contract(name, body);
    }

    @Test
    @DisplayName("合法程序")
    void testValid() {
        Program program = new Program(Arrays.asList(module("A"), module("B")),
                Collections.singletonList(contract("B")));
        assertEquals("A", program.getModules().get(0).getName());
        assertNotNull(program.findContract("B"));
        assertEquals(1, program.getModule("A").inputs().size());
    }

    @Test
    @DisplayName("契约多于模块")
    void testMoreContractsThanModules() {
        assertThrows(StructuralException.class, () -> new Program(
                Collections.singletonList(module("A")), Arrays.asList(contract("A"), contract("B"))));
    }

    @Test
    @DisplayName("一个模块两个契约")
    void testTwoContractsForOneModule() {
        assertThrows(StructuralException.class, () -> new Program(
                Arrays.asList(module("A"), module("B")), Arrays.asList(contract("A"), contract("A"))));
    }

    @Test
    @DisplayName("契约命名不存在的模块")
    void testContractForMissingModule() {
        assertThrows(StructuralException.class, () -> new Program(
                Arrays.asList(module("A"), module("B")), Collections.singletonList(contract("C"))));
    }

    @Test
    @DisplayName("没有条件的契约")
    void testContractWithoutConditions() {
        assertThrows(StructuralException.class,
                () -> new Contract("A", Collections.<Instruction>singletonList(Sort.bitvector(1, 1))));
    }

    @Test
    @DisplayName("按名字取不存在的模块")
    void testMissingModule() {
        Program program = new Program(Collections.singletonList(module("A")), Collections.<Contract>emptyList());
        assertThrows(UnresolvedReferenceException.class, () -> program.getModule("Z"));
    }
}
