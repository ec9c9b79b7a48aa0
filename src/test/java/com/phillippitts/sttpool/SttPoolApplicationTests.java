package com.phillippitts.sttpool;

import com.phillippitts.sttpool.domain.OutcomeKind;
import com.phillippitts.sttpool.domain.WorkPayload;
import com.phillippitts.sttpool.service.dispatch.TranscriptionDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "stt.pool.enabled=false")
class SttPoolApplicationTests {

    @Autowired
    private TranscriptionDispatcher dispatcher;

    @Test
    void contextLoads() {
        assertThat(dispatcher.snapshot().enabled()).isFalse();
    }

    @Test
    void disabledPoolAnswersWithoutSpawning() {
        assertThat(dispatcher.submit(WorkPayload.of("/tmp/none.wav")).kind()).isEqualTo(OutcomeKind.DISABLED);
        assertThat(dispatcher.snapshot().liveWorkers()).isZero();
    }
}
