package com.payments.controls;

import com.payments.controls.domain.RunSummary;
import com.payments.controls.loader.ControlsLoadException;
import com.payments.controls.service.ControlsRunService;
import io.quarkus.runtime.Quarkus;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.mockito.Mockito;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ControlsEngineApplicationTest {

    @Test
    void mainInvokesQuarkusRun() {
        try (MockedStatic<Quarkus> quarkus = Mockito.mockStatic(Quarkus.class)) {
            ControlsEngineApplication.main(new String[]{"arg"});
            quarkus.verify(() -> Quarkus.run(ControlsEngineApplication.class, new String[]{"arg"}));
        }
    }

    @Test
    void runReturnsZeroOnSuccess() {
        ControlsEngineApplication app = new ControlsEngineApplication();
        app.controlsRunService = mock(ControlsRunService.class);
        when(app.controlsRunService.run()).thenReturn(RunSummary.of(List.of(), List.of(), List.of()));

        assertThat(app.run()).isEqualTo(0);
    }

    @Test
    void runReturnsOneOnFatalError() {
        ControlsEngineApplication app = new ControlsEngineApplication();
        app.controlsRunService = mock(ControlsRunService.class);
        when(app.controlsRunService.run()).thenThrow(new ControlsLoadException("Missing controls file: x"));

        assertThat(app.run()).isEqualTo(1);
    }
}
