package com.saga.eventengine.runtime.generation;

import com.saga.eventengine.api.model.GenerationContext;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.infra.config.EngineConfig;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TemplateEngineTracingTest {

    @Mock
    private Tracer tracer;
    @Mock
    private SpanBuilder spanBuilder;
    @Mock
    private Span span;

    private TemplateEngine engine;

    @BeforeEach
    void setUp() {
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        engine = TemplateEngine.builder()
                .config(EngineConfig.forTesting())
                .tracer(tracer)
                .build();
        engine.registerTemplate("ambush", Template.builder().title("Ambush").narrative("Bandits!")
                .choice("Fight").choice("Flee").build());
    }

    @Test
    @DisplayName("A generation span records cache outcomes and choice count")
    void generationSpan() {
        GenerationContext context = GenerationContext.builder().level(3).build();

        engine.generateFromTemplate("ambush", context);
        engine.generateFromTemplate("ambush", context);

        verify(tracer, times(2)).spanBuilder("generate-from-template");
        verify(span, times(2)).setAttribute("templateId", "ambush");
        verify(span).setAttribute("generationCacheHit", false);
        verify(span).setAttribute("generationCacheHit", true);
        verify(span).setAttribute("processedCacheHit", false);
        verify(span, times(2)).setAttribute("choiceCount", 2L);
        verify(span, times(2)).end();
    }

    @Test
    @DisplayName("Unknown templates open no span")
    void noSpanForUnknownTemplate() {
        engine.generateFromTemplate("ghost", GenerationContext.empty());

        verifyNoInteractions(tracer);
    }
}
