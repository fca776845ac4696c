package org.pragmatica.reclass.render;

import org.junit.jupiter.api.Test;
import org.pragmatica.reclass.error.ReclassError;
import org.pragmatica.reclass.error.ReclassException;
import org.pragmatica.reclass.registry.RepeatSpec;
import org.pragmatica.reclass.registry.TokenRegistry;
import org.pragmatica.reclass.registry.TokenSpec;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class TemplateRendererTest {

    record Sample(boolean flag,
                  int count,
                  double ratio,
                  BigDecimal price,
                  LocalDate day,
                  LocalTime at,
                  UUID id,
                  String label) {}

    record Delivery(long orderId, LocalDateTime shippedAt, Optional<LocalDateTime> deliveredAt) {}

    record CalendarDate(int year, int month, int date) {}

    record Tags(String name, List<String> tags) {}

    interface Shape {}

    record Circle(int size) implements Shape {}

    record Square(int size) implements Shape {}

    record Drawing(String name, Shape shape) {}

    record Flag(String name, boolean enabled) {}

    record Code(String value) {}

    // === Round trips ===

    @Test
    void render_allScalarTypes_matchesBackToEqualInstance() {
        var registry = TokenRegistry.create();
        registry.register(Sample.class, "<flag>;<count>;<ratio>;<price>;<day>;<at>;<id>;<label>");
        var sample = new Sample(true,
                                -12,
                                2.5,
                                new BigDecimal("10.50"),
                                LocalDate.of(2025, 12, 29),
                                LocalTime.of(8, 30, 15),
                                UUID.fromString("123e4567-e89b-12d3-a456-426614174000"),
                                "some label");

        var text = TemplateRenderer.create(registry)
                                   .render(sample);

        assertThat(text).isEqualTo("true;-12;2.5;10.50;2025-12-29;08:30:15;123e4567-e89b-12d3-a456-426614174000;some label");
        assertThat(registry.fullMatch("<Sample>", text)
                           .get(Sample.class)).isEqualTo(sample);
    }

    @Test
    void render_optionalPart_writtenOnlyWithValue() {
        var registry = TokenRegistry.create();
        registry.register(Delivery.class, "order <order_id> shipped <shipped_at>(?: delivered <delivered_at>)?");
        var renderer = TemplateRenderer.create(registry);
        var pending = new Delivery(7, LocalDateTime.of(2025, 1, 2, 10, 0), Optional.empty());
        var delivered = new Delivery(8,
                                     LocalDateTime.of(2025, 1, 2, 10, 0),
                                     Optional.of(LocalDateTime.of(2025, 1, 3, 9, 30, 5)));

        assertThat(renderer.render(pending)).isEqualTo("order 7 shipped 2025-01-02 10:00:00");
        assertThat(renderer.render(delivered)).isEqualTo("order 8 shipped 2025-01-02 10:00:00 delivered 2025-01-03 09:30:05");
        assertThat(registry.fullMatch("<Delivery>", renderer.render(delivered))
                           .get(Delivery.class)).isEqualTo(delivered);
    }

    @Test
    void render_alternation_usesFirstBranch() {
        var registry = TokenRegistry.create();
        registry.register(TokenSpec.of(CalendarDate.class, "<year>-<month>-<date>|<year>/<month>/<date>")
                                   .name("DATE")
                                   .pattern("year", "\\d{4}")
                                   .pattern("month", "\\d{2}")
                                   .pattern("date", "\\d{2}"));

        var text = TemplateRenderer.create(registry)
                                   .render("DATE", new CalendarDate(2025, 12, 29));

        assertThat(text).isEqualTo("2025-12-29");
    }

    @Test
    void render_list_joinedWithJoinerOrEmptyLiteral() {
        var registry = TokenRegistry.create();
        registry.register(TokenSpec.of(Tags.class, "<name>(?:: <tags>)?")
                                   .pattern("name", "\\w+")
                                   .pattern("tags", "\\w+")
                                   .repeat("tags", RepeatSpec.DEFAULT.withEmpty("TBD")));
        var renderer = TemplateRenderer.create(registry);

        assertThat(renderer.render(new Tags("a", List.of("x", "y")))).isEqualTo("a: x, y");
        assertThat(renderer.render(new Tags("a", List.of()))).isEqualTo("a: TBD");
        assertThat(renderer.render(new Tags("a", null))).isEqualTo("a");
    }

    @Test
    void render_nestedAbstractField_rendersRuntimeSubtype() {
        var registry = TokenRegistry.create();
        registry.register(TokenSpec.of(Shape.class));
        registry.register(Circle.class, "circle <size>");
        registry.register(Square.class, "square <size>");
        registry.register(TokenSpec.of(Drawing.class, "<name>: <shape>")
                                   .pattern("name", "\\w+"));
        var drawing = new Drawing("logo", new Square(4));

        var text = TemplateRenderer.create(registry)
                                   .render(drawing);

        assertThat(text).isEqualTo("logo: square 4");
        assertThat(registry.fullMatch("<Drawing>", text)
                           .get(Drawing.class)).isEqualTo(drawing);
    }

    @Test
    void render_constants_selectBranchHoldingValue() {
        var registry = TokenRegistry.create();
        registry.register(TokenSpec.of(Flag.class, "<name>=(?:on<enabled=true>|off<enabled=false>)")
                                   .pattern("name", "\\w+"));
        var renderer = TemplateRenderer.create(registry);

        assertThat(renderer.render(new Flag("debug", true))).isEqualTo("debug=on");
        assertThat(renderer.render(new Flag("debug", false))).isEqualTo("debug=off");
    }

    // === Failures ===

    @Test
    void render_characterClassInTemplate_failsWithSyntaxError() {
        var registry = TokenRegistry.create();
        registry.register(TokenSpec.of(Code.class, "[A-Z]<value>")
                                   .pattern("value", "\\d+"));

        var thrown = catchThrowableOfType(() -> TemplateRenderer.create(registry)
                                                                .render(new Code("12")),
                                          ReclassException.class);

        assertThat(thrown.error()).isInstanceOf(ReclassError.TemplateSyntaxError.class);
        assertThat(thrown).hasMessageContaining("Cannot render");
    }

    @Test
    void render_missingRequiredValue_failsWithReconstructionError() {
        var registry = TokenRegistry.create();
        registry.register(Delivery.class, "order <order_id> shipped <shipped_at>(?: delivered <delivered_at>)?");

        var thrown = catchThrowableOfType(() -> TemplateRenderer.create(registry)
                                                                .render(new Delivery(1, null, Optional.empty())),
                                          ReclassException.class);

        assertThat(thrown.error()).isInstanceOf(ReclassError.ReconstructionError.class);
    }

    @Test
    void render_unregisteredType_failsWithUnknownToken() {
        var registry = TokenRegistry.create();

        assertThatThrownBy(() -> TemplateRenderer.create(registry)
                                                 .render(new Code("1")))
        .isInstanceOf(ReclassException.class)
        .hasMessageContaining("Unknown token");
    }

    @Test
    void render_abstractToken_fails() {
        var registry = TokenRegistry.create();
        registry.register(TokenSpec.of(Shape.class));
        registry.register(Circle.class, "circle <size>");

        assertThatThrownBy(() -> TemplateRenderer.create(registry)
                                                 .render("Shape", new Circle(1)))
        .isInstanceOf(IllegalArgumentException.class);
    }
}
