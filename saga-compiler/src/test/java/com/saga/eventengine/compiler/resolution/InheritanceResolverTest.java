package com.saga.eventengine.compiler.resolution;

import com.saga.eventengine.api.model.Choice;
import com.saga.eventengine.api.model.Condition;
import com.saga.eventengine.api.model.Template;
import com.saga.eventengine.compiler.TemplateLookup;
import com.saga.eventengine.infra.store.InMemoryTemplateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InheritanceResolverTest {

    private InMemoryTemplateStore store;
    private InheritanceResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryTemplateStore();
        resolver = new InheritanceResolver(new TemplateLookup(store));
    }

    private void register(Template template) {
        store.save("custom:" + template.id(), template);
    }

    private Template resolve(String id) {
        return resolver.resolve(store.findByKey("custom:" + id).orElseThrow(), "custom:" + id);
    }

    @Nested
    @DisplayName("inheritance")
    class Inheritance {

        @Test
        @DisplayName("Parent choices come before child choices")
        void parentChoicesFirst() {
            register(Template.builder("parent").title("P").narrative("P").choice("Flee").build());
            register(Template.builder("child").title("C").narrative("C").extendsFrom("parent").choice("Fight").build());

            assertThat(resolve("child").choices()).extracting(Choice::text).containsExactly("Flee", "Fight");
        }

        @Test
        @DisplayName("Inherited tags keep duplicates")
        void inheritedTagsKeepDuplicates() {
            register(Template.builder("parent").tags("road", "danger").build());
            register(Template.builder("child").extendsFrom("parent").tags("danger").build());

            assertThat(resolve("child").tags()).containsExactly("road", "danger", "danger");
        }

        @Test
        @DisplayName("Derived scalars win when present, otherwise the ancestor's are kept")
        void scalarsOverride() {
            register(Template.builder("parent").title("Parent title").narrative("Parent text")
                    .type("COMBAT").difficulty("hard").build());
            register(Template.builder("child").title("Child title").extendsFrom("parent").build());

            Template resolved = resolve("child");

            assertThat(resolved.id()).isEqualTo("child");
            assertThat(resolved.title()).isEqualTo("Child title");
            assertThat(resolved.narrative()).isEqualTo("Parent text");
            assertThat(resolved.type()).isEqualTo("COMBAT");
            assertThat(resolved.difficulty()).isEqualTo("hard");
        }

        @Test
        @DisplayName("Gating sections use the child's when present, else the parent's")
        void gatingSectionsChildOrParent() {
            List<Condition> parentGate = List.of(Condition.stat("level", "gte", 1));
            register(Template.builder("parent").conditions(parentGate).build());
            register(Template.builder("child").extendsFrom("parent").build());

            assertThat(resolve("child").conditions()).isEqualTo(parentGate);
        }

        @Test
        @DisplayName("Multi-level chains merge most distant ancestor first")
        void multiLevelChain() {
            register(Template.builder("root").choice("Root").build());
            register(Template.builder("middle").extendsFrom("root").choice("Middle").build());
            register(Template.builder("leaf").extendsFrom("middle").choice("Leaf").build());

            assertThat(resolve("leaf").choices()).extracting(Choice::text).containsExactly("Root", "Middle", "Leaf");
        }

        @Test
        @DisplayName("Shared ancestors are visited once")
        void diamondVisitsSharedAncestorOnce() {
            register(Template.builder("base").choice("Base").build());
            register(Template.builder("left").extendsFrom("base").choice("Left").build());
            register(Template.builder("right").extendsFrom("base").choice("Right").build());
            register(Template.builder("bottom").extendsFrom("left", "right").choice("Bottom").build());

            assertThat(resolve("bottom").choices()).extracting(Choice::text)
                    .containsExactly("Base", "Left", "Right", "Bottom");
        }

        @Test
        @DisplayName("Cycles terminate")
        void cyclesTerminate() {
            register(Template.builder("a").extendsFrom("b").choice("A").build());
            register(Template.builder("b").extendsFrom("a").choice("B").build());

            assertThat(resolve("a").choices()).extracting(Choice::text).containsExactly("B", "A");
        }

        @Test
        @DisplayName("Missing ancestors are skipped")
        void missingAncestorSkipped() {
            register(Template.builder("orphan").extendsFrom("ghost").choice("Alone").build());

            assertThat(resolve("orphan").choices()).extracting(Choice::text).containsExactly("Alone");
        }

        @Test
        @DisplayName("Library templates resolve parents inside their own genre")
        void genreRelativeParents() {
            store.save("fantasy:base", Template.builder("base").choice("Base").build());
            Template ambush = Template.builder("ambush").extendsFrom("base").choice("Ambush").build();
            store.save("fantasy:ambush", ambush);

            assertThat(resolver.resolve(ambush, "fantasy:ambush").choices()).extracting(Choice::text)
                    .containsExactly("Base", "Ambush");
        }

        @Test
        @DisplayName("A library template may extend the custom template sharing its id")
        void libraryTemplateExtendsCustomNamesake() {
            // Given
            register(Template.builder("camp").choice("Pitch tent").build());
            Template libraryCamp = Template.builder("camp").extendsFrom("custom:camp").choice("Keep watch").build();
            store.save("fantasy:camp", libraryCamp);

            // When
            Template resolved = resolver.resolve(libraryCamp, "fantasy:camp");

            // Then
            assertThat(resolved.choices()).extracting(Choice::text).containsExactly("Pitch tent", "Keep watch");
        }
    }

    @Nested
    @DisplayName("mixins")
    class Mixins {

        @Test
        @DisplayName("A choice contributed by two mixins appears once")
        void mixinChoicesDeduplicated() {
            register(Template.builder("m1").choice("Continue").choice("Rest").build());
            register(Template.builder("m2").choice("Continue").build());
            register(Template.builder("t").title("T").narrative("N").choice("Look around").mixins("m1", "m2").build());

            assertThat(resolve("t").choices()).extracting(Choice::text)
                    .containsExactly("Look around", "Continue", "Rest");
        }

        @Test
        @DisplayName("Template choices win text conflicts with mixins")
        void templateChoiceWinsConflict() {
            register(Template.builder("m").choice(new Choice("Fight", Map.of("gold", 1.0), null, null)).build());
            register(Template.builder("t").choice(new Choice("Fight", Map.of("gold", 9.0), null, null))
                    .mixins("m").build());

            assertThat(resolve("t").choices()).singleElement()
                    .satisfies(choice -> assertThat(choice.effect()).containsEntry("gold", 9.0));
        }

        @Test
        @DisplayName("Mixin tags are a set union with mixin tags first")
        void mixinTagsDeduplicated() {
            register(Template.builder("m").tags("magic", "night").build());
            register(Template.builder("t").tags("night", "forest").mixins("m").build());

            assertThat(resolve("t").tags()).containsExactly("magic", "night", "forest");
        }

        @Test
        @DisplayName("Mixins supply defaults only")
        void mixinSuppliesDefaults() {
            register(Template.builder("m").title("Mixin title").type("MYSTERY").build());
            register(Template.builder("t").title("Own title").mixins("m").build());

            Template resolved = resolve("t");

            assertThat(resolved.title()).isEqualTo("Own title");
            assertThat(resolved.type()).isEqualTo("MYSTERY");
            assertThat(resolved.mixins()).containsExactly("m");
        }

        @Test
        @DisplayName("Missing mixins are skipped")
        void missingMixinSkipped() {
            register(Template.builder("t").choice("Only").mixins("ghost").build());

            assertThat(resolve("t").choices()).extracting(Choice::text).containsExactly("Only");
        }
    }
}
