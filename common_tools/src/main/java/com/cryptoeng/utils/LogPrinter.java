/*
 * Copyright (c) 2026 textbook-rsa contributors, All Rights Reserved
 *
 */

package com.cryptoeng.utils;

import java.io.PrintStream;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Tagged log reporter. Messages are formatted on the caller thread and printed by a single
 * background daemon thread, so logging never blocks the crypto code. Debug messages are dropped
 * unless enabled with {@link #showDebug(boolean)}.
 */
public class LogPrinter {

    private static volatile boolean showDebugMessages = false;
    private static volatile PrintStream out = System.out;

    private final String tag;

    static public void showDebug(boolean show) {
        showDebugMessages = show;
    }

    static public boolean isDebugShown() {
        return showDebugMessages;
    }

    /**
     * Redirect all printers to the specified stream, e.g. to capture log in tests.
     */
    static public void printTo(PrintStream stream) {
        out = stream;
    }

    public LogPrinter(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public void d(String format, Object... objects) {
        if (showDebugMessages)
            log('d', format, objects);
    }

    public void d(Callable<String> source) {
        if (!showDebugMessages)
            return;
        es.submit(() -> {
            try {
                outputLog('d', source.call());
            } catch (Exception e) {
                wtf("Exception in log source callable", e);
            }
        });
    }

    public void i(String format, Object... objects) {
        log('i', format, objects);
    }

    public void w(String format, Object... objects) {
        log('w', format, objects);
    }

    public void e(String format, Object... objects) {
        log('e', format, objects);
    }

    /**
     * What a Terrible Failure: log the message and the stack trace of the cause.
     */
    public void wtf(String message, Throwable t) {
        log('f', "%s: %s", message, t);
        t.printStackTrace(out);
    }

    public void log(char type, String message, Object... params) {
        if (type == 'd' && !showDebugMessages)
            return;
        final String text = params.length == 0 ? message : String.format(message, params);
        es.submit(() -> outputLog(type, text));
    }

    protected void outputLog(char type, String message) {
        out.printf("%c %s %s\n", Character.toUpperCase(type), tag, message);
    }

    private static final ExecutorService es = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "log-printer");
        t.setDaemon(true);
        return t;
    });
}
