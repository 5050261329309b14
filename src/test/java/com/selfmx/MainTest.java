package com.selfmx;

import com.selfmx.auth.AdminLoginService;
import com.selfmx.auth.AdminSessionStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    private static class CapturingMain extends Main {
        private final List<String> out = new ArrayList<>();

        CapturingMain(String... args) {
            super(args);
        }

        @Override
        void print(String string) {
            out.add(string);
        }
    }

    @Test
    void hashPasswordPrintsUsableHash() {
        CapturingMain main = new CapturingMain("--hash-password", "s3cret-admin");

        assertEquals(0, main.run());
        assertEquals(1, main.out.size());
        String hash = main.out.get(0);
        assertTrue(hash.startsWith("$2"));

        AdminLoginService login = new AdminLoginService(hash,
                new AdminSessionStore(Duration.ofDays(1), Clock.systemUTC()));
        assertTrue(login.login("s3cret-admin").isPresent());
    }

    @Test
    void noCommandPrintsUsage() {
        CapturingMain main = new CapturingMain();

        assertEquals(1, main.run());
        String usage = String.join("\n", main.out);
        assertTrue(usage.contains(Main.USAGE));
        assertTrue(usage.contains("--server"));
        assertTrue(usage.contains("--hash-password"));
    }

    @Test
    void unknownOptionIsReported() {
        CapturingMain main = new CapturingMain("--bogus");

        assertEquals(1, main.run());
        assertTrue(main.out.get(0).startsWith("Options error:"));
    }

    @Test
    void missingPasswordArgumentIsReported() {
        CapturingMain main = new CapturingMain("--hash-password");

        assertEquals(1, main.run());
        assertTrue(main.out.get(0).startsWith("Options error:"));
    }
}
