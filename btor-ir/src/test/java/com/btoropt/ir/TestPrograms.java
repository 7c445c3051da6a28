package com.btoropt.ir;

import com.btoropt.compiler.model.Instruction;
import com.btoropt.compiler.model.Program;
import com.btoropt.compiler.parser.Btor2Parser;
import com.btoropt.compiler.parser.ModularParser;
import com.btoropt.compiler.parser.ParseStrategy;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 测试用程序构造
 */
public final class TestPrograms {

    private TestPrograms() {}

    public static List<Instruction> flat(String... lines) {
        return Btor2Parser.create(ParseStrategy.EAGER).parse(Arrays.asList(lines));
    }

    public static Program modular(String... lines) {
        return new ModularParser().parse(Arrays.asList(lines));
    }

    public static Program modularResource(String name) {
        InputStream in = TestPrograms.class.getResourceAsStream("/" + name);
        if (in == null) throw new IllegalArgumentException("missing test resource " + name);
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return new ModularParser().parse(reader.lines().collect(Collectors.toList()));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String text(String... lines) {
        return String.join("\n", lines);
    }
}
