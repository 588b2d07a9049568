package com.tessera.sandbox;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class LocalSandboxProviderTest {

    @TempDir
    Path workspace;

    private LocalSandboxProvider provider;
    private ShellChannel channel;
    private final StringBuffer output = new StringBuffer();
    private final CountDownLatch ended = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        provider = new LocalSandboxProvider("/bin/sh");
        String target = provider.createTarget(workspace);
        channel = provider.openShell(target, TerminalSize.DEFAULT, new OutputSink() {
            @Override
            public void onOutput(byte[] data) {
                output.append(new String(data, StandardCharsets.UTF_8));
            }

            @Override
            public void onClosed() {
                ended.countDown();
            }
        });
    }

    @AfterEach
    void tearDown() {
        channel.close();
    }

    @Test
    @DisplayName("TERM stops the running command and keeps the shell")
    void terminateRunningCommand() throws Exception {
        channel.write("sleep 30; echo after-$?\n".getBytes(StandardCharsets.UTF_8));
        await(LocalSandboxProviderTest::sleepRunning);

        channel.signal(ShellSignal.TERM);

        await(() -> output.toString().contains("after-143"));
        assertTrue(channel.isOpen());
    }

    @Test
    @DisplayName("INT with nothing running leaves the shell alone")
    void interruptIdleShell() throws Exception {
        channel.signal(ShellSignal.INT);
        channel.write("echo still-here\n".getBytes(StandardCharsets.UTF_8));

        await(() -> output.toString().contains("still-here"));
        assertTrue(channel.isOpen());
    }

    @Test
    @DisplayName("KILL with nothing running ends the shell")
    void killIdleShell() throws Exception {
        channel.signal(ShellSignal.KILL);

        assertTrue(ended.await(5, TimeUnit.SECONDS));
        await(() -> !channel.isOpen());
    }

    private static boolean sleepRunning() {
        return ProcessHandle.current().descendants()
                .anyMatch(p -> p.info().command().map(c -> c.endsWith("sleep")).orElse(false));
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(condition.getAsBoolean(), "condition not met within 10s");
    }
}
