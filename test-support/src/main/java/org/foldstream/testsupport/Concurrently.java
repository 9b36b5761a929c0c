/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.foldstream.testsupport;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

/**
 * Runs tasks that are released at the same time by a start gate.
 */
public class Concurrently {

    /**
     * Runs {@code numberOfTasks} tasks concurrently and returns their results in task order.
     */
    public static <T> List<T> run(int numberOfTasks, Task<T> task) throws InterruptedException, ExecutionException {
        ExecutorService executorService = Executors.newFixedThreadPool(Math.min(numberOfTasks, 16));
        try {
            CountDownLatch startGate = new CountDownLatch(1);
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < numberOfTasks; i++) {
                int taskNumber = i;
                futures.add(executorService.submit(() -> {
                    startGate.await();
                    return task.run(taskNumber);
                }));
            }
            startGate.countDown();
            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } catch (TimeoutException e) {
            throw new IllegalStateException("Concurrent tasks didn't complete in time", e);
        } finally {
            executorService.shutdownNow();
        }
    }

    /**
     * Like {@link #run(int, Task)} but a {@link RuntimeException} thrown by a task is returned as its result.
     */
    public static List<Object> attempt(int numberOfTasks, Task<?> task) throws InterruptedException, ExecutionException {
        return run(numberOfTasks, taskNumber -> {
            try {
                return task.run(taskNumber);
            } catch (RuntimeException e) {
                return e;
            }
        });
    }

    @FunctionalInterface
    public interface Task<T> {
        T run(int taskNumber);
    }
}
