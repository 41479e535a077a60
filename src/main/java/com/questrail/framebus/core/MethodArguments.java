package com.questrail.framebus.core;

import com.questrail.framebus.api.SignalValue;

import java.util.List;

/**
 * Positional argument helpers for the built-in frame and port methods.
 */
final class MethodArguments
{
    private MethodArguments() {}

    static SignalValue at(List<SignalValue> args, int index, String method) {
        if (index >= args.size()) {
            throw new IllegalArgumentException(
                    method + ": expected at least " + (index + 1) + " argument(s), got " + args.size());
        }
        return args.get(index);
    }

    static String text(List<SignalValue> args, int index, String method) {
        return at(args, index, method).asText();
    }

    static byte[] bytes(List<SignalValue> args, int index, String method) {
        return at(args, index, method).asBytes();
    }
}
