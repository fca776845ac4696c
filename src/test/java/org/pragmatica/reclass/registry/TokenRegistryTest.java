package org.pragmatica.reclass.registry;

import org.junit.jupiter.api.Test;
import org.pragmatica.reclass.error.ReclassError;
import org.pragmatica.reclass.error.ReclassException;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class TokenRegistryTest {

    record Day(int year, int month, int day) {}

    record Entry(String title, Optional<LocalDate> due, List<String> tags) {}

    record Word(String text) {}

    record Holder(Object thing) {}

    interface Shape {}

    record Circle(int size) implements Shape {}

    record Square(int size) implements Shape {}

    interface Vehicle {}

    interface Car extends Vehicle {}

    record SportsCar(int hp) implements Car {}

    record Sedan(int doors) implements Car {}

    record Truck(int tons) implements Vehicle {}

    static final class Plain {}

    // === Field inference ===

    @Test
    void register_record_infersFieldsFromComponents() {
        var registry = TokenRegistry.create();

        var token = registry.register(Day.class, "<year>-<month>-<day>");

        assertThat(token.name()).isEqualTo("Day");
        assertThat(token.fields()).extracting(FieldDefinition::name)
                                  .containsExactly("year", "month", "day");
        assertThat(token.fields()).extracting(FieldDefinition::type)
                                  .containsOnly(ScalarType.INTEGER);
    }

    @Test
    void register_optionalAndListComponents_inferOptionalAndListFields() {
        var registry = TokenRegistry.create();

        var token = registry.register(Entry.class, "<title>(?: due <due>)?(?: \\[<tags>\\])?");

        var due = token.field("due")
                       .orElseThrow();
        assertThat(due.type()).isEqualTo(ScalarType.DATE);
        assertThat(due.optional()).isTrue();
        assertThat(token.field("tags")
                        .orElseThrow()
                        .type()).isEqualTo(FieldType.listOf(ScalarType.TEXT));
    }

    @Test
    void register_registeredComponentType_infersNestedField() {
        record Span(Day from, Day to) {}
        var registry = TokenRegistry.create();
        registry.register(Day.class, "<year>-<month>-<day>");

        var token = registry.register(Span.class, "<from>\\.\\.<to>");

        assertThat(token.field("from")
                        .orElseThrow()
                        .type()).isEqualTo(FieldType.nested("Day"));
        assertThat(token.field("from")
                        .orElseThrow()
                        .effectivePattern()).contains("<Day>");
    }

    @Test
    void register_singleFieldWithoutTemplate_usesFieldPlaceholder() {
        var registry = TokenRegistry.create();

        var token = registry.register(TokenSpec.of(Word.class)
                                               .pattern("text", "\\w+"));

        assertThat(token.template()).contains("<text>");
        assertThat(token.field("text")
                        .orElseThrow()
                        .pattern()).contains("\\w+");
    }

    @Test
    void register_overridesApplyOnTopOfInferredFields() {
        var registry = TokenRegistry.create();

        var token = registry.register(TokenSpec.of(Entry.class, "<title>(?: due <due>)?(?: \\[<tags>\\])?")
                                               .pattern("title", "[A-Z]\\w*")
                                               .defaultValue("due", LocalDate.of(2030, 1, 1))
                                               .repeat("tags", RepeatSpec.DEFAULT.withRequired(true)));

        assertThat(token.field("title")
                        .orElseThrow()
                        .pattern()).contains("[A-Z]\\w*");
        assertThat(token.field("due")
                        .orElseThrow()
                        .defaultValue()).contains(LocalDate.of(2030, 1, 1));
        assertThat(token.field("tags")
                        .orElseThrow()
                        .repeat()
                        .required()).isTrue();
    }

    @Test
    void field_snakeCaseName_findsCamelCaseField() {
        record Order(long orderId) {}
        var registry = TokenRegistry.create();

        var token = registry.register(Order.class, "#<order_id>");

        assertThat(token.field("order_id")).map(FieldDefinition::name)
                                           .contains("orderId");
    }

    // === Registration errors ===

    @Test
    void register_sameNameTwice_failsWithDuplicateToken() {
        var registry = TokenRegistry.create();
        registry.register(Day.class, "<year>-<month>-<day>");

        var thrown = catchThrowableOfType(() -> registry.register(Day.class, "<day>.<month>.<year>"),
                                          ReclassException.class);

        assertThat(thrown.error()).isEqualTo(new ReclassError.DuplicateToken("Day"));
    }

    @Test
    void register_sameTypeUnderOtherName_isAllowed() {
        var registry = TokenRegistry.create();
        registry.register(Day.class, "<year>-<month>-<day>");

        var token = registry.register(TokenSpec.of(Day.class, "<day>\\.<month>\\.<year>")
                                               .name("EuropeanDay"));

        assertThat(registry.tokens()).extracting(TokenDefinition::name)
                                     .containsExactly("Day", "EuropeanDay");
        assertThat(registry.tokenFor(Day.class)).map(TokenDefinition::name)
                                                .contains("Day");
        assertThat(token.type()).isEqualTo(Day.class);
    }

    @Test
    void register_componentWithoutDefaultPattern_failsWithMissingFieldPattern() {
        var registry = TokenRegistry.create();

        var thrown = catchThrowableOfType(() -> registry.register(Holder.class, "<thing>"), ReclassException.class);

        assertThat(thrown.error()).isInstanceOf(ReclassError.MissingFieldPattern.class);
        assertThat(((ReclassError.MissingFieldPattern) thrown.error()).field()).isEqualTo("thing");
    }

    @Test
    void register_componentWithoutDefaultPatternButExplicitPattern_usesText() {
        var registry = TokenRegistry.create();

        var token = registry.register(TokenSpec.of(Holder.class, "<thing>")
                                               .pattern("thing", "\\w+"));

        assertThat(token.field("thing")
                        .orElseThrow()
                        .type()).isEqualTo(ScalarType.TEXT);
    }

    @Test
    void register_nestedFieldOfUnknownToken_failsWithMissingFieldPattern() {
        var registry = TokenRegistry.create();

        assertThatThrownBy(() -> registry.register(TokenSpec.of(Holder.class, "<thing>")
                                                            .field("thing", FieldType.nested("Nope"))))
        .isInstanceOf(ReclassException.class)
        .hasMessageContaining("'Nope' is not registered");
    }

    @Test
    void register_unknownSupertype_failsWithInvalidSubtypeLink() {
        var registry = TokenRegistry.create();

        var thrown = catchThrowableOfType(() -> registry.register(TokenSpec.of(Word.class)
                                                                           .supertype("Nope")),
                                          ReclassException.class);

        assertThat(thrown.error()).isInstanceOf(ReclassError.InvalidSubtypeLink.class);
    }

    @Test
    void register_supertypeOfUnrelatedType_failsWithInvalidSubtypeLink() {
        var registry = TokenRegistry.create();
        registry.register(Day.class, "<year>-<month>-<day>");

        var thrown = catchThrowableOfType(() -> registry.register(TokenSpec.of(Word.class)
                                                                           .supertype("Day")),
                                          ReclassException.class);

        assertThat(thrown.error()).isInstanceOf(ReclassError.InvalidSubtypeLink.class);
        assertThat(thrown).hasMessageContaining("is not a subtype of");
    }

    @Test
    void register_overrideForUnknownField_failsWithInvalidTokenSpec() {
        var registry = TokenRegistry.create();

        var thrown = catchThrowableOfType(() -> registry.register(TokenSpec.of(Word.class)
                                                                           .pattern("missing", "x")),
                                          ReclassException.class);

        assertThat(thrown.error()).isEqualTo(new ReclassError.InvalidTokenSpec("Word", "unknown fields missing"));
    }

    @Test
    void register_nonRecordWithoutFactory_failsWithInvalidTokenSpec() {
        var registry = TokenRegistry.create();

        var thrown = catchThrowableOfType(() -> registry.register(TokenSpec.of(Plain.class, "plain")),
                                          ReclassException.class);

        assertThat(thrown.error()).isInstanceOf(ReclassError.InvalidTokenSpec.class);
        assertThat(thrown).hasMessageContaining("needs an InstanceFactory");
    }

    @Test
    void register_severalFieldsWithoutTemplate_failsWithInvalidTokenSpec() {
        var registry = TokenRegistry.create();

        assertThatThrownBy(() -> registry.register(TokenSpec.of(Day.class)))
        .isInstanceOf(ReclassException.class)
        .hasMessageContaining("Invalid token 'Day': template is required for 3 fields");
        assertThat(registry.find("Day")).isEmpty();
    }

    @Test
    void lookup_unknownName_failsWithUnknownToken() {
        var registry = TokenRegistry.create();

        var thrown = catchThrowableOfType(() -> registry.lookup("Nope"), ReclassException.class);

        assertThat(thrown.error()).isEqualTo(new ReclassError.UnknownToken("Nope"));
        assertThat(registry.find("Nope")).isEmpty();
    }

    // === Subtypes ===

    @Test
    void register_implementingRegisteredInterface_infersSupertype() {
        var registry = TokenRegistry.create();
        var shape = registry.register(TokenSpec.of(Shape.class));

        var circle = registry.register(Circle.class, "circle <size>");

        assertThat(shape.isAbstract()).isTrue();
        assertThat(circle.supertype()).contains("Shape");
        assertThat(registry.isSubtype(circle, shape)).isTrue();
        assertThat(registry.subtypes(shape)).containsExactly(circle);
    }

    @Test
    void register_subtype_inheritsFieldPatternOfSupertype() {
        var registry = TokenRegistry.create();
        registry.register(TokenSpec.of(Shape.class)
                                   .field("size", ScalarType.INTEGER)
                                   .pattern("size", "\\d{1,3}"));

        var circle = registry.register(Circle.class, "circle <size>");
        var square = registry.register(TokenSpec.of(Square.class, "square <size>")
                                                .pattern("size", "\\d"));

        assertThat(circle.field("size")
                         .orElseThrow()
                         .pattern()).contains("\\d{1,3}");
        assertThat(square.field("size")
                         .orElseThrow()
                         .pattern()).contains("\\d");
    }

    @Test
    void alternatives_nestedHierarchy_mostSpecificFirstInRegistrationOrder() {
        var registry = TokenRegistry.create();
        var vehicle = registry.register(TokenSpec.of(Vehicle.class));
        var car = registry.register(TokenSpec.of(Car.class));
        registry.register(Truck.class, "truck <tons>t");
        registry.register(SportsCar.class, "sportscar <hp>hp");
        registry.register(Sedan.class, "sedan <doors>");

        assertThat(registry.alternatives(vehicle)).extracting(TokenDefinition::name)
                                                  .containsExactly("SportsCar", "Sedan", "Truck");
        assertThat(registry.alternatives(car)).extracting(TokenDefinition::name)
                                              .containsExactly("SportsCar", "Sedan");
        assertThat(registry.supertypes(registry.lookup("Sedan"))).extracting(TokenDefinition::name)
                                                                 .containsExactly("Car", "Vehicle");
    }

    // === Independent registries ===

    @Test
    void registries_areIndependent() {
        var first = TokenRegistry.create();
        var second = TokenRegistry.create();

        first.register(Day.class, "<year>-<month>-<day>");
        second.register(Day.class, "<day>/<month>/<year>");

        assertThat(first.lookup("Day")
                        .template()).contains("<year>-<month>-<day>");
        assertThat(second.lookup("Day")
                         .template()).contains("<day>/<month>/<year>");
        assertThat(TokenRegistry.create()
                                .find("Day")).isEmpty();
    }
}
