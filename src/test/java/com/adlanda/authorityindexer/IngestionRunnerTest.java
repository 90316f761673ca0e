package com.adlanda.authorityindexer;

import com.adlanda.authorityindexer.config.IngestionProperties;
import com.adlanda.authorityindexer.exception.EmbeddingProviderException;
import com.adlanda.authorityindexer.exception.EmbeddingRunException;
import com.adlanda.authorityindexer.model.IngestionSummary;
import com.adlanda.authorityindexer.service.IngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IngestionRunnerTest {

    @Mock
    private IngestionService ingestionService;

    private IngestionProperties properties;
    private IngestionRunner runner;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        runner = new IngestionRunner(ingestionService, properties);
    }

    @Test
    void run_disabled_doesNothing() {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(ingestionService);
    }

    @Test
    void run_enabled_ingestsDocsDirectory() {
        properties.setEnabled(true);
        when(ingestionService.ingestAllDocuments()).thenReturn(new IngestionSummary(1, 2, 1, 50L, 0.000001, false));

        runner.run(new DefaultApplicationArguments());

        verify(ingestionService).ingestAllDocuments();
    }

    @Test
    void run_fatalFailure_isLoggedNotThrown() {
        properties.setEnabled(true);
        when(ingestionService.ingestAllDocuments()).thenThrow(
                new EmbeddingRunException(0, 1, 10, 0, new EmbeddingProviderException("401 - bad key")));

        assertThatCode(() -> runner.run(new DefaultApplicationArguments())).doesNotThrowAnyException();
    }
}
