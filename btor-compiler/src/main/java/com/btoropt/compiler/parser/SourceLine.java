package com.btoropt.compiler.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * 一行 BTOR2 源码：行号、原文与按空白切分的 token。
 */
public final class SourceLine {

    private final int number;
    private final String text;
    private final String[] tokens;

    public SourceLine(int number, String text) {
        this.number = number;
        this.text = text;
        String trimmed = text.trim();
        this.tokens = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    }

    /**
     * 给原始行编号（从 1 开始）。
     */
    public static List<SourceLine> number(List<String> lines) {
        List<SourceLine> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            result.add(new SourceLine(i + 1, lines.get(i)));
        }
        return result;
    }

    public int getNumber() { return number; }
    public String getText() { return text; }

    public String token(int i) {
        return tokens[i];
    }

    public int tokenCount() {
        return tokens.length;
    }

    /** 空行或以 {@code ;} 开头的整行注释 */
    public boolean isBlankOrComment() {
        return tokens.length == 0 || tokens[0].startsWith(";");
    }
}
