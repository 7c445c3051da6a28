package com.btoropt.compiler.model;

import com.btoropt.compiler.error.StructuralException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 契约：与同名模块关联的前置条件 / 后置条件（Hoare 三元组）。
 * <p>
 * 契约体只允许标准指令以及 ref / prec / post，且至少包含一个 prec 或 post。
 */
public class Contract {

    private final String name;
    private final List<Instruction> body;
    private final List<Instruction> preconditions = new ArrayList<>();
    private final List<Instruction> postconditions = new ArrayList<>();

    public Contract(String name, List<Instruction> body) {
        this.name = name;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
        for (Instruction inst : body) {
            if (inst.getOpcode() == Opcode.PREC) preconditions.add(inst);
            else if (inst.getOpcode() == Opcode.POST) postconditions.add(inst);
        }
        if (preconditions.isEmpty() && postconditions.isEmpty()) {
            throw new StructuralException("Contract " + name
                    + " must contain either a precondition or a postcondition");
        }
    }

    /** 关联模块的名字 */
    public String getName() { return name; }
    public List<Instruction> getBody() { return body; }
    public List<Instruction> getPreconditions() { return Collections.unmodifiableList(preconditions); }
    public List<Instruction> getPostconditions() { return Collections.unmodifiableList(postconditions); }
}
