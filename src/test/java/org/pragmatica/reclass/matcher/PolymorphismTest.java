package org.pragmatica.reclass.matcher;

import org.junit.jupiter.api.Test;
import org.pragmatica.reclass.error.ReclassException;
import org.pragmatica.reclass.registry.ScalarType;
import org.pragmatica.reclass.registry.TokenRegistry;
import org.pragmatica.reclass.registry.TokenSpec;

import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolymorphismTest {

    interface Shape {}

    record Circle(int size) implements Shape {}

    record Square(int size) implements Shape {}

    record Drawing(String name, Shape shape) {}

    interface Vehicle {}

    interface Car extends Vehicle {}

    record SportsCar(int hp) implements Car {}

    record Sedan(int doors) implements Car {}

    record Truck(int tons) implements Vehicle {}

    static class Coordinate {
        private final int x;
        private final int y;

        Coordinate(int x, int y) {
            this.x = x;
            this.y = y;
        }

        public int x() {
            return x;
        }

        public int y() {
            return y;
        }

        @Override
        public boolean equals(Object o) {
            return o != null && o.getClass() == getClass() && ((Coordinate) o).x == x && ((Coordinate) o).y == y;
        }

        @Override
        public int hashCode() {
            return Objects.hash(x, y);
        }
    }

    static final class Point3D extends Coordinate {
        private final int z;

        Point3D(int x, int y, int z) {
            super(x, y);
            this.z = z;
        }

        public int z() {
            return z;
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && ((Point3D) o).z == z;
        }

        @Override
        public int hashCode() {
            return Objects.hash(x(), y(), z);
        }
    }

    private static TokenRegistry shapes() {
        var registry = TokenRegistry.create();
        registry.register(TokenSpec.of(Shape.class));
        registry.register(Circle.class, "circle <size>");
        registry.register(Square.class, "square <size>");
        return registry;
    }

    private static TokenRegistry vehicles() {
        var registry = TokenRegistry.create();
        registry.register(TokenSpec.of(Vehicle.class));
        registry.register(TokenSpec.of(Car.class));
        registry.register(Truck.class, "truck <tons>t");
        registry.register(SportsCar.class, "sportscar <hp>hp");
        registry.register(Sedan.class, "sedan <doors> doors");
        return registry;
    }

    private static TokenRegistry coordinates() {
        var registry = TokenRegistry.create();
        registry.register(TokenSpec.of(Coordinate.class, "\\(<x>, <y>\\)")
                                   .field("x", ScalarType.INTEGER)
                                   .field("y", ScalarType.INTEGER)
                                   .factory(values -> new Coordinate(values.<Long>get("x")
                                                                           .intValue(),
                                                                     values.<Long>get("y")
                                                                           .intValue())));
        registry.register(TokenSpec.of(Point3D.class, "<Coordinate> z=<z>")
                                   .field("x", ScalarType.INTEGER)
                                   .field("y", ScalarType.INTEGER)
                                   .field("z", ScalarType.INTEGER)
                                   .factory(values -> new Point3D(values.<Long>get("x")
                                                                        .intValue(),
                                                                  values.<Long>get("y")
                                                                        .intValue(),
                                                                  values.<Long>get("z")
                                                                        .intValue())));
        return registry;
    }

    // === Abstract supertype ===

    @Test
    void match_abstractToken_buildsMatchingSubtype() {
        var registry = shapes();

        var matches = registry.findAll("<Shape>", "circle 5; square 3");

        assertThat(matches).extracting(match -> match.get(Shape.class))
                           .containsExactly(new Circle(5), new Square(3));
    }

    @Test
    void get_subtypeOfOtherBranch_returnsNull() {
        var match = shapes().match("<Shape>", "square 3");

        assertThat(match.get(Square.class)).isEqualTo(new Square(3));
        assertThat(match.get(Circle.class)).isNull();
    }

    @Test
    void match_nestedAbstractField_buildsSubtypeInside() {
        var registry = shapes();
        registry.register(TokenSpec.of(Drawing.class, "<name>: <shape>")
                                   .pattern("name", "\\w+"));

        var drawing = registry.match("<Drawing>", "logo: circle 12")
                              .get(Drawing.class);

        assertThat(drawing).isEqualTo(new Drawing("logo", new Circle(12)));
    }

    @Test
    void match_abstractTokenWithoutSubtypes_fails() {
        var registry = TokenRegistry.create();
        registry.register(TokenSpec.of(Shape.class));

        assertThatThrownBy(() -> registry.compile("<Shape>"))
        .isInstanceOf(ReclassException.class)
        .hasMessageContaining("no concrete subtypes");
    }

    // === Intermediate types ===

    @Test
    void get_intermediateType_viewsOnlyItsAlternatives() {
        var match = vehicles().match("<Vehicle> and <Vehicle>", "sportscar 300hp and truck 5t");

        assertThat(match.get(Vehicle.class, 1)).isEqualTo(new SportsCar(300));
        assertThat(match.get(Vehicle.class, 2)).isEqualTo(new Truck(5));
        assertThat(match.get(Car.class, 1)).isEqualTo(new SportsCar(300));
        assertThat(match.get(Car.class, 2)).isNull();
        assertThat(match.get(Truck.class, 2)).isEqualTo(new Truck(5));
        assertThat(match.get(Truck.class, 1)).isNull();
    }

    @Test
    void match_mostSpecificAlternativeTriedFirst() {
        var matcher = vehicles().compile("<Vehicle>");

        assertThat(matcher.pattern()).startsWith("(?:(sportscar ")
                                     .contains("|(sedan ")
                                     .endsWith("t))");
        assertThat(matcher.construct("sedan 4 doors")).isEqualTo(new Sedan(4));
    }

    @Test
    void get_concreteSubtypeReference_countsForSupertypes() {
        var match = vehicles().match("<Sedan>", "sedan 2 doors");

        assertThat(match.get(Car.class)).isEqualTo(new Sedan(2));
        assertThat(match.get(Vehicle.class)).isEqualTo(new Sedan(2));
    }

    // === Concrete supertype with template ===

    @Test
    void match_subtypeReferencingSupertype_inlinesSupertypeFields() {
        var point = coordinates().match("<Point3D>", "(1, 2) z=3")
                                 .get(Point3D.class);

        assertThat(point).isEqualTo(new Point3D(1, 2, 3));
    }

    @Test
    void match_concreteSupertype_prefersSubtypeAndFallsBackToItself() {
        var registry = coordinates();

        var deep = registry.match("<Coordinate>", "(1, 2) z=3");
        var flat = registry.match("<Coordinate>", "(4, 5)");

        assertThat(deep.get(Coordinate.class)).isEqualTo(new Point3D(1, 2, 3));
        assertThat(flat.get(Coordinate.class)).isEqualTo(new Coordinate(4, 5));
        assertThat(flat.get(Point3D.class)).isNull();
    }
}
