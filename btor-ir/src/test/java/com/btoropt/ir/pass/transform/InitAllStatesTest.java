package com.btoropt.ir.pass.transform;

import com.btoropt.compiler.model.*;
import com.btoropt.compiler.model.Module;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ForkJoinPool;

import static com.btoropt.ir.TestPrograms.*;
import static org.assertj.core.api.Assertions.*;

@DisplayName("init-all-states 测试")
class InitAllStatesTest {

    @Test
    @DisplayName("为未初始化的 state 插入零初始化并重新编号")
    void testInsertsZeroInit() {
        List<Instruction> after = new InitAllStates().run(flat(
                "1 sort bitvec 4",
                "2 state 1 s",
                "3 state 1 t",
                "4 zero 1",
                "5 init 1 3 4",
                "6 next 1 2 2"));

        assertThat(Btor2Printer.print(after)).isEqualTo(text(
                "1 sort bitvec 4",
                "2 state 1 s",
                "3 constd 1 0",
                "4 init 1 2 3",
                "5 state 1 t",
                "6 zero 1",
                "7 init 1 5 6",
                "8 next 1 2 2"));
    }

    @Test
    @DisplayName("每个 state 恰有一个零初始化，lid 从 1 连续")
    void testEveryStateInitialized() {
        List<Instruction> after = new InitAllStates().run(flat(
                "1 sort bitvec 8",
                "2 sort bitvec 1",
                "3 input 2 en",
                "4 state 1 a",
                "5 state 2 b",
                "6 ite 1 3 4 4",
                "7 next 1 4 6"));
        InstructionTable table = InstructionTable.of(after);

        for (int i = 0; i < after.size(); i++) {
            assertThat(after.get(i).getLid()).isEqualTo(i + 1);
        }
        for (Instruction inst : after) {
            if (inst.getOpcode() != Opcode.STATE) continue;
            long inits = after.stream()
                    .filter(x -> x.getOpcode() == Opcode.INIT && x.operand(1) == inst.getLid())
                    .count();
            assertThat(inits).isEqualTo(1);
            Instruction init = after.stream()
                    .filter(x -> x.getOpcode() == Opcode.INIT && x.operand(1) == inst.getLid())
                    .findFirst().get();
            Literal zero = (Literal) table.get(init.operand(2));
            assertThat(zero.isZero()).isTrue();
            assertThat(zero.sortLid()).isEqualTo(inst.sortLid());
        }
    }

    @Test
    @DisplayName("模块化程序中 ref 跟随被重新编号的目标")
    void testRetargetsRefs() {
        Program program = modular(
                "module A {",
                "1 sort bitvec 4",
                "2 input 1 x",
                "3 state 1 s",
                "4 output 3",
                "}",
                "module Top {",
                "1 sort bitvec 4",
                "2 inst A",
                "3 ref A 4",
                "4 output 3",
                "}");
        Program after = new InitAllStates().runOnProgram(program, ForkJoinPool.commonPool());

        Module a = after.getModule("A");
        assertThat(a.getBody()).hasSize(6);
        assertThat(a.find(6).getOpcode()).isEqualTo(Opcode.OUTPUT);

        Ref ref = (Ref) after.getModule("Top").find(3);
        assertThat(ref.getTargetLid()).isEqualTo(6);
        assertThat(ref.getTarget()).isSameAs(a.find(6));
    }
}
