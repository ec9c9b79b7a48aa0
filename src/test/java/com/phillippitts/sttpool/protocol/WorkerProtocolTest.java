package com.phillippitts.sttpool.protocol;

import com.phillippitts.sttpool.domain.FailureKind;
import com.phillippitts.sttpool.domain.Outcome;
import com.phillippitts.sttpool.domain.OutcomeKind;
import com.phillippitts.sttpool.domain.TranscriptionResult;
import com.phillippitts.sttpool.domain.TranscriptionSegment;
import com.phillippitts.sttpool.domain.WorkPayload;
import com.phillippitts.sttpool.domain.WorkUnit;
import com.phillippitts.sttpool.exception.WorkerProtocolException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkerProtocolTest {

    @Test
    void encodesEachMessageOnASingleLine() {
        WorkUnit unit = WorkUnit.create(new WorkPayload("/tmp/line\nbreak.wav", Map.of("language", "en")));

        String line = WorkerProtocol.encode(WorkerMessage.work(unit));

        assertThat(line).doesNotContain("\n");
        assertThat(new JSONObject(line).getString("type")).isEqualTo("work");
    }

    @Test
    void workMessageCarriesPathAndParams() {
        WorkUnit unit = WorkUnit.create(new WorkPayload("/tmp/a.wav", Map.of("language", "de")));

        WorkerMessage decoded = WorkerProtocol.decode(WorkerProtocol.encode(WorkerMessage.work(unit)));

        assertThat(decoded.type()).isEqualTo(WorkerMessage.Type.WORK);
        assertThat(decoded.work()).isEqualTo(unit);
        assertThat(decoded.work().payload().language()).isEqualTo("de");
    }

    @Test
    void successOutcomeKeepsSegments() {
        TranscriptionSegment segment = new TranscriptionSegment("hello world", 0.1, 1.2, 0.8, null, "en");
        TranscriptionResult result = new TranscriptionResult("hello world", "en", List.of(segment), null, 0.8, 42);
        Outcome outcome = Outcome.success("unit-1", result);

        WorkerMessage decoded = WorkerProtocol.decode(WorkerProtocol.encode(WorkerMessage.outcome(outcome, 7)));

        assertThat(decoded.type()).isEqualTo(WorkerMessage.Type.OUTCOME);
        assertThat(decoded.tasksCompleted()).isEqualTo(7);
        assertThat(decoded.outcome().result()).isEqualTo(result);
        assertThat(decoded.outcome().completedAt()).isEqualTo(outcome.completedAt());
    }

    @Test
    void failureOutcomeKeepsClassification() {
        Outcome outcome = Outcome.failure("unit-2", FailureKind.INVALID_INPUT, "InvalidAudioException", "too short");

        Outcome decoded = WorkerProtocol.decode(WorkerProtocol.encode(WorkerMessage.outcome(outcome, 1))).outcome();

        assertThat(decoded.kind()).isEqualTo(OutcomeKind.FAILURE);
        assertThat(decoded.failureKind()).isEqualTo(FailureKind.INVALID_INPUT);
        assertThat(decoded.errorType()).isEqualTo("InvalidAudioException");
        assertThat(decoded.message()).isEqualTo("too short");
        assertThat(decoded.result()).isNull();
    }

    @Test
    void decodesReadyAndShutdown() {
        assertThat(WorkerProtocol.decode("{\"type\":\"ready\",\"pid\":4242}").pid()).isEqualTo(4242);
        assertThat(WorkerProtocol.decode("{\"type\":\"shutdown\"}").type()).isEqualTo(WorkerMessage.Type.SHUTDOWN);
    }

    @Test
    void rejectsMalformedLines() {
        assertThatThrownBy(() -> WorkerProtocol.decode("")).isInstanceOf(WorkerProtocolException.class);
        assertThatThrownBy(() -> WorkerProtocol.decode("not json")).isInstanceOf(WorkerProtocolException.class);
        assertThatThrownBy(() -> WorkerProtocol.decode("{\"type\":\"bogus\"}"))
                .isInstanceOf(WorkerProtocolException.class);
        assertThatThrownBy(() -> WorkerProtocol.decode("{\"type\":\"work\",\"id\":\"x\"}"))
                .isInstanceOf(WorkerProtocolException.class);
        assertThatThrownBy(() -> WorkerProtocol.decode("{\"type\":\"outcome\",\"id\":\"x\",\"kind\":\"SUCCESS\"}"))
                .isInstanceOf(WorkerProtocolException.class);
    }

    @Test
    void rejectsOversizedLine() {
        String huge = "{\"type\":\"shutdown\",\"pad\":\"" + "x".repeat(WorkerProtocol.MAX_LINE_CHARS) + "\"}";

        assertThatThrownBy(() -> WorkerProtocol.decode(huge))
                .isInstanceOf(WorkerProtocolException.class)
                .hasMessageContaining("exceeds");
    }
}
