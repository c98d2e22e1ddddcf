package com.saga.eventengine.compiler.composition;

import com.saga.eventengine.api.ITemplateStore;
import com.saga.eventengine.api.model.Choice;
import com.saga.eventengine.api.model.Condition;
import com.saga.eventengine.api.model.GenerationContext;
import com.saga.eventengine.api.model.MergeStrategy;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.api.model.TemplateComposition;
import com.saga.eventengine.compiler.TemplateLookup;
import com.saga.eventengine.runtime.condition.ConditionEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CompositionEngineTest {

    @Mock
    private ITemplateStore store;

    private CompositionEngine engine;

    private final Template weather = Template.builder("weather").title("Storm").narrative("Rain falls.")
            .type("WEATHER").choice("Take shelter").tags("storm").build();
    private final Template loot = Template.builder("loot").choice("Search the bodies").tags("loot").build();

    @BeforeEach
    void setUp() {
        when(store.findByKey(anyString())).thenReturn(Optional.empty());
        when(store.findByKey("custom:weather")).thenReturn(Optional.of(weather));
        when(store.findByKey("custom:loot")).thenReturn(Optional.of(loot));
        engine = new CompositionEngine(new TemplateLookup(store), new ConditionEvaluator());
    }

    private Template base(TemplateComposition... entries) {
        return Template.builder("base").title("Ambush").narrative("Bandits!").type("COMBAT")
                .choice("Fight").tags("combat").composition(List.of(entries)).build();
    }

    @Test
    @DisplayName("Append adds component choices and tags after the template's")
    void append() {
        Template result = engine.compose(base(TemplateComposition.of("loot", 0, MergeStrategy.APPEND)),
                GenerationContext.empty(), "custom:base");

        assertThat(result.choices()).extracting(Choice::text).containsExactly("Fight", "Search the bodies");
        assertThat(result.tags()).containsExactly("combat", "loot");
        assertThat(result.title()).isEqualTo("Ambush");
    }

    @Test
    @DisplayName("Prepend adds component choices and tags before the template's")
    void prepend() {
        Template result = engine.compose(base(TemplateComposition.of("loot", 0, MergeStrategy.PREPEND)),
                GenerationContext.empty(), "custom:base");

        assertThat(result.choices()).extracting(Choice::text).containsExactly("Search the bodies", "Fight");
        assertThat(result.tags()).containsExactly("loot", "combat");
    }

    @Test
    @DisplayName("Replace overwrites present fields but keeps the template's identity")
    void replace() {
        Template result = engine.compose(base(TemplateComposition.of("weather", 0, MergeStrategy.REPLACE)),
                GenerationContext.empty(), "custom:base");

        assertThat(result.id()).isEqualTo("base");
        assertThat(result.title()).isEqualTo("Storm");
        assertThat(result.choices()).extracting(Choice::text).containsExactly("Take shelter");
        assertThat(result.composition()).hasSize(1);
    }

    @Test
    @DisplayName("Merge overwrites scalars and concatenates choices, template first")
    void merge() {
        Template result = engine.compose(base(new TemplateComposition("weather", null, null, null)),
                GenerationContext.empty(), "custom:base");

        assertThat(result.type()).isEqualTo("WEATHER");
        assertThat(result.choices()).extracting(Choice::text).containsExactly("Fight", "Take shelter");
        assertThat(result.tags()).containsExactly("combat", "storm");
    }

    @Test
    @DisplayName("Entries apply in ascending priority regardless of declaration order")
    void priorityOrder() {
        Template result = engine.compose(base(
                        TemplateComposition.of("weather", 5, MergeStrategy.APPEND),
                        TemplateComposition.of("loot", 1, MergeStrategy.APPEND)),
                GenerationContext.empty(), "custom:base");

        assertThat(result.choices()).extracting(Choice::text)
                .containsExactly("Fight", "Search the bodies", "Take shelter");
    }

    @Test
    @DisplayName("Gated entries apply only when their conditions hold")
    void gatedEntries() {
        TemplateComposition gated = new TemplateComposition("loot", 0,
                List.of(Condition.stat("level", "gte", 10)), "append");

        Template low = engine.compose(base(gated), GenerationContext.builder().level(3).build(), "custom:base");
        Template high = engine.compose(base(gated), GenerationContext.builder().level(12).build(), "custom:base");

        assertThat(low.choices()).hasSize(1);
        assertThat(high.choices()).hasSize(2);
    }

    @Test
    @DisplayName("Missing components are skipped")
    void missingComponent() {
        Template result = engine.compose(base(TemplateComposition.of("ghost", 0, MergeStrategy.APPEND)),
                GenerationContext.empty(), "custom:base");

        assertThat(result.choices()).extracting(Choice::text).containsExactly("Fight");
        verify(store).findByKey("custom:ghost");
    }

    @Test
    @DisplayName("Templates without composition are returned unchanged")
    void noComposition() {
        Template plain = Template.builder("plain").choice("Go").build();

        assertThat(engine.compose(plain, GenerationContext.empty(), "custom:plain")).isSameAs(plain);
        verifyNoInteractions(store);
    }
}
