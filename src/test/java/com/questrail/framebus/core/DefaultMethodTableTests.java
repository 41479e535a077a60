package com.questrail.framebus.core;

import com.questrail.framebus.api.SignalValue;
import com.questrail.framebus.error.ErrorKind;
import com.questrail.framebus.error.MethodInvocationException;
import com.questrail.framebus.error.UnknownMethodException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultMethodTableTests
{
    @Test
    void invokesTheBoundFunctionWithItsArguments() {
        DefaultMethodTable table = new DefaultMethodTable("test");
        table.registerMethod("add", args -> SignalValue.of(args.get(0).asInt32() + args.get(1).asInt32()));

        assertEquals(SignalValue.of(5), table.invoke("add", List.of(SignalValue.of(2), SignalValue.of(3))));
    }

    @Test
    void unknownMethodFails() {
        DefaultMethodTable table = new DefaultMethodTable("test");

        UnknownMethodException e = assertThrows(UnknownMethodException.class, () -> table.invoke("missing"));
        assertEquals(ErrorKind.UNKNOWN_METHOD, e.kind());
    }

    @Test
    void reRegistrationOverwrites() {
        DefaultMethodTable table = new DefaultMethodTable("test");
        table.registerMethod("m", args -> SignalValue.of(1));
        table.registerMethod("m", args -> SignalValue.of(2));

        assertEquals(SignalValue.of(2), table.invoke("m"));
        assertEquals(List.of("m"), table.listMethods());
    }

    @Test
    void listMethodsIsSorted() {
        DefaultMethodTable table = new DefaultMethodTable("test");
        table.registerMethod("zeta", args -> null);
        table.registerMethod("alpha", args -> null);
        table.registerMethod("mid", args -> null);

        assertEquals(List.of("alpha", "mid", "zeta"), table.listMethods());
    }

    @Test
    void nullResultBecomesNone() {
        DefaultMethodTable table = new DefaultMethodTable("test");
        table.registerMethod("nothing", args -> null);

        assertSame(SignalValue.none(), table.invoke("nothing"));
    }

    @Test
    void runtimeFailuresPropagateAndCheckedFailuresAreWrapped() {
        DefaultMethodTable table = new DefaultMethodTable("test");
        table.registerMethod("boom", args -> { throw new IllegalStateException("boom"); });
        table.registerMethod("io", args -> { throw new IOException("disk"); });

        assertThrows(IllegalStateException.class, () -> table.invoke("boom"));

        MethodInvocationException e = assertThrows(MethodInvocationException.class, () -> table.invoke("io"));
        assertEquals(ErrorKind.INVOCATION_FAILED, e.kind());
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    void functionsMayReenterTheirOwnTable() {
        DefaultMethodTable table = new DefaultMethodTable("test");
        table.registerMethod("inner", args -> SignalValue.of(7));
        table.registerMethod("outer", args -> {
            table.registerMethod("late", a -> SignalValue.of(8));
            return table.invoke("inner");
        });

        assertEquals(SignalValue.of(7), table.invoke("outer"));
        assertEquals(SignalValue.of(8), table.invoke("late"));
    }
}
