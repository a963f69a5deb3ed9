// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jarray.test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import jarray.array.Overrides;
import jarray.array.ValueArray;
import jarray.preset.Presets;
import jarray.status.ArrayError;
import jarray.status.Status;
import jarray.status.StatusChannel;
import jarray.util.Trace;
import static jarray.test.TestArrays.integers;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class StatusChannelTest {
    @BeforeEach
    void resetChannel() {
        StatusChannel.clear();
    }

    @Test
    void lastStatusFollowsEveryOperation() {
        final var array = integers(1, 2, 3);
        final var failed = array.removeAt(7);
        assertThat(StatusChannel.last()).isSameAs(failed);
        assertThat(failed.isOk()).isFalse();
        assertThat(failed.is(ArrayError.INDEX_OUT_OF_BOUND)).isTrue();
        assertThat(failed.message()).isEqualTo("Index 7 out of bound for remove");
        assertThat(failed.source()).isSameAs(array);
        assertThat(array.add(4).isOk()).isTrue();
        assertThat(StatusChannel.last()).isSameAs(Status.OK);
    }

    @Test
    void clearResetsToSuccess() {
        assertThat(Presets.integers().remove().isOk()).isFalse();
        StatusChannel.clear();
        assertThat(StatusChannel.last().isOk()).isTrue();
        assertThat(StatusChannel.last().message()).isEqualTo("No error");
    }

    @Test
    void messagesAreTruncated() {
        final var status = StatusChannel.failure(null, ArrayError.INVALID_ARGUMENT, "x".repeat(150));
        assertThat(status.message()).hasSize(Status.MAX_MESSAGE_LENGTH);
        assertThat(StatusChannel.last().message()).hasSize(99);
    }

    @Test
    void defaultRendering() {
        final var array = integers(1);
        assertThat(array.at(5).isOk()).isFalse();
        final var output = render("Main.java", 42);
        assertThat(output).isEqualTo(
            "Main.java:42 [Error: Index out of bound] : Index 5 is out of bound" + System.lineSeparator());
    }

    @Test
    void successRendersNothing() {
        assertThat(integers(1).add(2).isOk()).isTrue();
        assertThat(render("Main.java", 1)).isEmpty();
    }

    @Test
    void renderingIncludesTraces() {
        final var array = ValueArray.<Integer>create();
        assertThat(array.addm(1, 2).isOk()).isTrue();
        try (final var trace = new Trace("cleaning up the inventory")) {
            trace.use();
            assertThat(array.removeAll(List.of(1)).error()).isEqualTo(ArrayError.EQUALITY_CALLBACK_MISSING);
        }
        assertThat(StatusChannel.last().traces())
            .containsExactly("removing all occurrences of 1 values", "cleaning up the inventory");
        final var newline = System.lineSeparator();
        assertThat(render("Inventory.java", 7)).isEqualTo(
            "Inventory.java:7 [Error: is_equal callback not set] : is_equal callback not set" + newline
                + " - removing all occurrences of 1 values" + newline
                + " - cleaning up the inventory" + newline);
    }

    @Test
    void customRendererReplacesDefault() {
        final var array = integers(1);
        final var seen = new AtomicReference<Status>();
        assertThat(array.setOverrides(Overrides.<Integer>none().withErrorRenderer((status, stream) -> {
            seen.set(status);
            stream.print("custom: " + status.error());
        })).isOk()).isTrue();
        final var failed = array.set(3, 1);
        assertThat(render("Main.java", 1)).isEqualTo("custom: INDEX_OUT_OF_BOUND");
        assertThat(seen.get()).isSameAs(failed);
    }

    @Test
    void statusDoesNotKeepSourceAlive() {
        final var array = integers(1);
        assertThat(array.setOverrides(Overrides.<Integer>none().withErrorRenderer((status, stream) ->
            stream.print("custom"))).isOk()).isTrue();
        final var failed = array.at(2);
        assertThat(failed.status().source()).isSameAs(array);
        final var reference = failed.status().sourceReference();
        assertThat(reference).isNotNull();
        reference.clear();
        assertThat(StatusChannel.last().source()).isNull();
        assertThat(render("Main.java", 9)).isEqualTo(
            "Main.java:9 [Error: Index out of bound] : Index 2 is out of bound" + System.lineSeparator());
    }

    @Test
    void statusIsPerThread() throws InterruptedException {
        final var otherThreadStatus = new AtomicReference<Status>();
        final var thread = new Thread(() -> {
            Presets.integers().remove();
            otherThreadStatus.set(StatusChannel.last());
        });
        assertThat(integers(1).add(2).isOk()).isTrue();
        thread.start();
        thread.join();
        assertThat(otherThreadStatus.get().error()).isEqualTo(ArrayError.EMPTY);
        assertThat(StatusChannel.last().isOk()).isTrue();
    }

    @Test
    void everyErrorKindHasDescription() {
        final var descriptions = new ArrayList<String>();
        for (final var kind : ArrayError.values()) {
            descriptions.add(kind.description());
        }
        assertThat(descriptions).doesNotHaveDuplicates().doesNotContain("");
        assertThat(ArrayError.EMPTY.description()).isEqualTo("Empty jarray");
    }

    private static String render(final String file, final int line) {
        final var output = new ByteArrayOutputStream();
        try (final var stream = new PrintStream(output, true, StandardCharsets.UTF_8)) {
            StatusChannel.print(stream, file, line);
        }
        return output.toString(StandardCharsets.UTF_8);
    }
}
