package com.btoropt.compiler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 具名模块：一段有序的指令体（标准指令加 inst / ref / set）。
 */
public class Module {

    private final String name;
    private final List<Instruction> body;
    private InstructionTable table;

    public Module(String name, List<Instruction> body) {
        this.name = name;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    public String getName() { return name; }
    public List<Instruction> getBody() { return body; }

    /** 按 lid 查找模块内的指令，不存在返回 null */
    public Instruction find(int lid) {
        return table().get(lid);
    }

    /** 模块体的查找表（惰性构建） */
    public synchronized InstructionTable table() {
        if (table == null) {
            table = InstructionTable.of(body);
        }
        return table;
    }

    /** 模块中声明的 input，按出现顺序 */
    public List<Declaration> inputs() {
        List<Declaration> result = new ArrayList<>();
        for (Instruction inst : body) {
            if (inst.getOpcode() == Opcode.INPUT) result.add((Declaration) inst);
        }
        return result;
    }

    public Module withBody(List<Instruction> newBody) {
        return new Module(name, newBody);
    }
}
