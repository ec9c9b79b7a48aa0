package com.phillippitts.sttpool.worker;

import com.phillippitts.sttpool.worker.vosk.VoskWorkFunction;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkFunctionsTest {

    @Test
    void resolvesBuiltInNamesCaseInsensitively() {
        assertThat(WorkFunctions.resolve("echo")).isInstanceOf(EchoWorkFunction.class);
        assertThat(WorkFunctions.resolve(" VOSK ")).isInstanceOf(VoskWorkFunction.class);
    }

    @Test
    void resolvesClassName() {
        assertThat(WorkFunctions.resolve(ScriptedWorkFunction.class.getName()))
                .isInstanceOf(ScriptedWorkFunction.class);
    }

    @Test
    void rejectsUnknownOrIncompatibleNames() {
        assertThatThrownBy(() -> WorkFunctions.resolve(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WorkFunctions.resolve("com.example.DoesNotExist"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Cannot instantiate");
        assertThatThrownBy(() -> WorkFunctions.resolve(String.class.getName()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not implement");
    }
}
