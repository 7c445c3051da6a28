package com.btoropt.compiler.model;

import java.util.List;

/**
 * BTOR2 文本输出。
 */
public final class Btor2Printer {

    private Btor2Printer() {}

    /**
     * 每条指令一行，换行连接（末尾无换行）。
     */
    public static String print(List<? extends Instruction> instructions) {
        StringBuilder sb = new StringBuilder();
        for (Instruction inst : instructions) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(inst.serialize());
        }
        return sb.toString();
    }

    /**
     * 输出模块化程序：先全部模块，再全部契约。
     */
    public static String print(Program program) {
        StringBuilder sb = new StringBuilder();
        for (Module m : program.getModules()) {
            appendBlock(sb, "module", m.getName(), m.getBody());
        }
        for (Contract c : program.getContracts()) {
            appendBlock(sb, "contract", c.getName(), c.getBody());
        }
        return sb.toString();
    }

    private static void appendBlock(StringBuilder sb, String keyword, String name, List<Instruction> body) {
        if (sb.length() > 0) sb.append('\n');
        sb.append(keyword).append(' ').append(name).append(" {\n");
        for (Instruction inst : body) {
            sb.append(inst.serialize()).append('\n');
        }
        sb.append('}');
    }
}
