package com.btoropt.compiler.parser;

import com.btoropt.compiler.error.StructuralException;
import com.btoropt.compiler.error.UnresolvedReferenceException;
import com.btoropt.compiler.model.*;

/**
 * 在查找表上解析并校验指令的操作数，两种解析策略共用。
 * <p>
 * 每个操作数必须已在表中声明，且种类与槽位要求一致（sort 槽位必须是 sort，等等）。
 */
public final class OperandResolver {

    private OperandResolver() {}

    /**
     * @throws UnresolvedReferenceException 操作数未声明或种类不符
     * @throws StructuralException          set 绑定的 ref 与实例不属于同一模块，或 ref 目标不是 input
     */
    public static void resolve(Instruction inst, InstructionTable table, SourceLine line) {
        Opcode opcode = inst.getOpcode();
        for (int i = 0; i < inst.operandCount(); i++) {
            int lid = inst.operand(i);
            Instruction target = table.get(lid);
            if (target == null) {
                throw new UnresolvedReferenceException("Undeclared instruction used with id: " + lid,
                        lid, line.getNumber(), line.getText());
            }
            OperandKind kind = opcode.slot(i);
            if (!kind.accepts(target.getOpcode())) {
                throw new UnresolvedReferenceException(opcode.getToken() + " operand " + (i + 1)
                        + " must be " + kind.describe() + ", found " + target.getOpcode().getToken()
                        + " (id " + lid + ")", lid, line.getNumber(), line.getText());
            }
        }
        if (opcode == Opcode.SET) {
            checkBinding(inst, table, line);
        }
    }

    private static void checkBinding(Instruction set, InstructionTable table, SourceLine line) {
        Instance instance = (Instance) table.get(set.operand(0));
        Ref ref = (Ref) table.get(set.operand(1));
        if (!ref.getModuleName().equals(instance.getModuleName())) {
            throw new StructuralException("`set` can only set a reference to an instance input: ref "
                    + ref.qualifiedName() + " does not belong to module " + instance.getModuleName(),
                    line.getNumber(), line.getText());
        }
        if (ref.getTarget().getOpcode() != Opcode.INPUT) {
            throw new StructuralException("Only inputs can be set, not " + ref.getTarget().getOpcode().getToken(),
                    line.getNumber(), line.getText());
        }
    }
}
