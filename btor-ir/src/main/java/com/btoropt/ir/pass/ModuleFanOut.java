package com.btoropt.ir.pass;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 按提交顺序（而非完成顺序）收集并行任务的结果。
 */
final class ModuleFanOut {

    private ModuleFanOut() {}

    /**
     * 任一任务失败时重新抛出其原始异常。
     */
    static <T> List<T> gather(List<CompletableFuture<T>> futures) {
        List<T> results = new ArrayList<>(futures.size());
        for (CompletableFuture<T> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                if (cause instanceof Error) throw (Error) cause;
                throw e;
            }
        }
        return results;
    }
}
