package com.btoropt.cli;

import com.btoropt.compiler.error.Btor2Exception;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 子命令共用的文件读取、日志级别和错误报告。
 */
final class CommandSupport {

    static final int OK = 0;
    static final int FAILED = 1;

    private CommandSupport() {}

    static List<String> readLines(Path path) throws IOException {
        return Files.readAllLines(path, StandardCharsets.UTF_8);
    }

    /**
     * --verbose 时把根 logger 及其 handler 降到 FINE。
     */
    static void configureLogging(boolean verbose) {
        if (!verbose) return;
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        boolean hasConsole = false;
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
            hasConsole |= handler instanceof ConsoleHandler;
        }
        if (!hasConsole) {
            ConsoleHandler handler = new ConsoleHandler();
            handler.setLevel(Level.FINE);
            root.addHandler(handler);
        }
    }

    static int report(PrintWriter err, Btor2Exception e) {
        err.println("错误: " + e.getMessage());
        err.flush();
        return FAILED;
    }

    static int report(PrintWriter err, IOException e, Path file) {
        if (e instanceof NoSuchFileException) {
            err.println("错误: 文件不存在 - " + file);
        } else {
            err.println("错误: 无法读取文件 " + file + " - " + e.getMessage());
        }
        err.flush();
        return FAILED;
    }
}
