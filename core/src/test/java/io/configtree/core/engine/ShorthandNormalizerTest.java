package io.configtree.core.engine;

import static io.configtree.core.engine.TestSchemas.yaml;
import static io.configtree.core.schema.SchemaNode.group;
import static io.configtree.core.schema.SchemaNode.list;
import static io.configtree.core.schema.SchemaNode.map;
import static io.configtree.core.schema.SchemaNode.scalar;
import static io.configtree.core.schema.SchemaNode.string;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.configtree.core.error.InvalidTypeError;
import io.configtree.core.error.InvalidValueError;
import io.configtree.core.error.ShapeError;
import io.configtree.core.error.UnknownKeyError;
import io.configtree.core.schema.SchemaNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ShorthandNormalizer")
class ShorthandNormalizerTest {

    private final SchemaNode app = TestSchemas.app();
    private final ShorthandNormalizer normalizer = new ShorthandNormalizer();

    private JsonNode normalize(String document) {
        return normalizer.normalize(app, yaml(document), "app");
    }

    @Nested
    @DisplayName("Toggle groups")
    class ToggleGroups {

        @Test
        @DisplayName("Boolean → {enabled: b}")
        void booleanForm() {
            assertThat(normalizer.normalize(app.child("cache"), BooleanNode.FALSE, "app.cache"))
                    .isEqualTo(yaml("{enabled: false}"));
        }

        @Test
        @DisplayName("Null → enabled")
        void nullForm() {
            assertThat(normalizer.normalize(app.child("queue"), NullNode.getInstance(), "app.queue"))
                    .isEqualTo(yaml("{enabled: true}"));
        }

        @Test
        @DisplayName("Map without flag → enabled")
        void mapWithoutFlag() {
            assertThat(normalize("queue: {dsn: 'amqp://q'}").get("queue"))
                    .isEqualTo(yaml("{enabled: true, dsn: 'amqp://q'}"));
        }

        @Test
        @DisplayName("Explicit flag kept")
        void explicitFlag() {
            assertThat(normalize("queue: {enabled: false, label: x}").get("queue"))
                    .isEqualTo(yaml("{enabled: false, label: x}"));
        }
    }

    @Nested
    @DisplayName("Shorthand child")
    class ShorthandChild {

        @Test
        @DisplayName("Scalar → default entry of the shorthand map")
        void scalar() {
            assertThat(normalize("cache: redis").get("cache"))
                    .isEqualTo(yaml("{enabled: true, pools: {default: [redis]}}"));
        }

        @Test
        @DisplayName("List with an {enabled: b} item → flag extracted")
        void listWithFlag() {
            assertThat(normalize("cache: [{enabled: false}, redis, apcu]").get("cache"))
                    .isEqualTo(yaml("{enabled: false, pools: {default: [redis, apcu]}}"));
        }

        @Test
        @DisplayName("Map without declared keys → named entries, flag extracted")
        void mapWithoutDeclaredKeys() {
            assertThat(normalize("cache: {enabled: false, sessions: redis, app: [apcu, redis]}").get("cache"))
                    .isEqualTo(yaml("{enabled: false, pools: {sessions: [redis], app: [apcu, redis]}}"));
        }

        @Test
        @DisplayName("Only a flag left → shorthand child omitted")
        void onlyFlag() {
            assertThat(normalize("cache: [{enabled: true}]").get("cache")).isEqualTo(yaml("{enabled: true}"));
        }

        @Test
        @DisplayName("Singular alias in list form collects repeated names")
        void aliasCollects() {
            assertThat(normalize("""
                            cache:
                              pool:
                                - {name: app, value: apcu}
                                - {name: app, value: redis}
                                - {name: other, value: [memcached]}
                            """)
                            .get("cache"))
                    .isEqualTo(yaml("{enabled: true, pools: {app: [apcu, redis], other: [memcached]}}"));
        }

        @Test
        @DisplayName("Singular alias wraps a scalar; plural wins when both given")
        void aliasWrapsScalar() {
            assertThat(normalize("tag: blue").get("tags")).isEqualTo(yaml("[blue]"));
            assertThat(normalize("{tag: blue, tags: [red]}").get("tags")).isEqualTo(yaml("[red]"));
        }

        @Test
        @DisplayName("Id-only and single-key entries")
        void singleKeyShorthand() {
            assertThat(normalize("handlers: [auth, {id: log}, {retry: [3, true]}]").get("handlers"))
                    .isEqualTo(yaml("[{id: auth}, {id: log}, {id: retry, args: [3, true]}]"));
        }

        @Test
        @DisplayName("Single-key form with several keys → ShapeError")
        void singleKeyWithSeveralKeys() {
            assertThatThrownBy(() -> normalize("handlers: [{a: 1, b: 2}]"))
                    .isInstanceOf(ShapeError.class)
                    .extracting(e -> ((ShapeError) e).path())
                    .isEqualTo("app.handlers.0");
        }
    }

    @Nested
    @DisplayName("Keys")
    class Keys {

        @Test
        @DisplayName("Dashed key read as underscored")
        void dashedKey() {
            assertThat(normalize("default-route: home").get("default_route").asText()).isEqualTo("home");
        }

        @Test
        @DisplayName("Map entry names kept verbatim")
        void mapEntriesVerbatim() {
            assertThat(normalize("routes: {home-page: /, Admin_Area: /admin}").get("routes"))
                    .isEqualTo(yaml("{home-page: /, Admin_Area: /admin}"));
        }

        @Test
        @DisplayName("Unknown key → UnknownKeyError listing declared children")
        void unknownKey() {
            assertThatThrownBy(() -> normalize("tls: {cert: a, pem: b}"))
                    .isInstanceOf(UnknownKeyError.class)
                    .hasMessage("Unrecognized option \"pem\" under \"app.tls\". Available options are \"cert\","
                            + " \"ca_bundle\", \"insecure\".");
        }

        @Test
        @DisplayName("Result follows schema order")
        void schemaOrder() {
            JsonNode result = normalize("{port: 1, name: x}");

            assertThat(result.fieldNames()).toIterable().containsExactly("name", "port");
        }
    }

    @Nested
    @DisplayName("Collections")
    class Collections {

        @Test
        @DisplayName("Scalar under a list → single-element list; null → empty")
        void listForms() {
            assertThat(normalize("hosts: a.example").get("hosts")).isEqualTo(yaml("[a.example]"));
            assertThat(normalize("hosts: null").get("hosts")).isEqualTo(yaml("[]"));
        }

        @Test
        @DisplayName("Group items in list form keep their key attribute")
        void keyedList() {
            assertThat(normalize("users: [{email: a@x}]").get("users")).isEqualTo(yaml("[{email: a@x}]"));
        }

        @Test
        @DisplayName("Unnamed list item for a map without default key → ShapeError")
        void unnamedItem() {
            assertThatThrownBy(() -> normalize("routes: [/home]"))
                    .isInstanceOf(ShapeError.class)
                    .hasMessageContaining("an entry with a \"name\" attribute was expected");
        }

        @Test
        @DisplayName("Named list items become map entries")
        void namedItems() {
            assertThat(normalize("routes: [{name: home, value: /}]").get("routes")).isEqualTo(yaml("{home: /}"));
        }

        @Test
        @DisplayName("Unnamed items of a list-valued map accumulate under the default key")
        void unnamedItemsAccumulate() {
            SchemaNode root = group("root")
                    .children(map("resources", list("stores", string("store"))).defaultKey("default"))
                    .build();

            assertThat(normalizer.normalize(root, yaml("resources: [a, b]"), "root").get("resources"))
                    .isEqualTo(yaml("{default: [a, b]}"));
            assertThat(normalizer.normalize(root, yaml("resources: [a, {name: x, value: c}, b]"), "root")
                            .get("resources"))
                    .isEqualTo(yaml("{default: [a, b], x: [c]}"));
        }

        @Test
        @DisplayName("Several unnamed items for a scalar-valued map → ShapeError")
        void unnamedScalarsRejected() {
            SchemaNode root = group("root")
                    .children(map("labels", string("label")).defaultKey("default"))
                    .build();

            assertThat(normalizer.normalize(root, yaml("labels: [a]"), "root").get("labels"))
                    .isEqualTo(yaml("{default: a}"));
            assertThatThrownBy(() -> normalizer.normalize(root, yaml("labels: [a, b]"), "root"))
                    .isInstanceOf(ShapeError.class)
                    .extracting(e -> ((ShapeError) e).path())
                    .isEqualTo("root.labels.1");
        }

        @Test
        @DisplayName("Scalar for a map without default key → ShapeError")
        void scalarForMap() {
            assertThatThrownBy(() -> normalize("routes: /home"))
                    .isInstanceOf(ShapeError.class)
                    .hasMessage("Invalid type for path \"app.routes\". Expected \"array\", but got \"string\".");
        }

        @Test
        @DisplayName("Scalar for a plain group → ShapeError")
        void scalarForGroup() {
            assertThatThrownBy(() -> normalize("tls: 5"))
                    .isInstanceOf(ShapeError.class)
                    .hasMessage("Invalid type for path \"app.tls\". Expected \"array\", but got \"int\".");
        }
    }

    @Nested
    @DisplayName("Scalars")
    class Scalars {

        @Test
        @DisplayName("Container for a scalar → ShapeError")
        void containerForScalar() {
            assertThatThrownBy(() -> normalize("name: [a]"))
                    .isInstanceOf(ShapeError.class)
                    .hasMessage("Invalid type for path \"app.name\". Expected \"string\", but got \"array\".");
        }

        @Test
        @DisplayName("Text coerced to the declared type")
        void coercion() {
            JsonNode result = normalize("{port: '9090', debug: 'TRUE', ratio: '0.5'}");

            assertThat(result.get("port").isInt()).isTrue();
            assertThat(result.get("port").intValue()).isEqualTo(9090);
            assertThat(result.get("debug")).isEqualTo(BooleanNode.TRUE);
            assertThat(result.get("ratio").doubleValue()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Text for a mixed scalar read as the boolean or number it accepts")
        void mixedScalarLiterals() {
            SchemaNode root = group("root")
                    .children(
                            scalar("secure").allowedValues(true, false, "auto"),
                            scalar("level").defaultValue(3),
                            scalar("label").defaultValue("x"))
                    .build();

            JsonNode literals = normalizer.normalize(root, yaml("{secure: 'TRUE', level: ' 5', label: 'true'}"), "root");
            assertThat(literals.get("secure")).isEqualTo(BooleanNode.TRUE);
            assertThat(literals.get("level").isInt()).isTrue();
            assertThat(literals.get("level").intValue()).isEqualTo(5);
            assertThat(literals.get("label").isTextual()).isTrue();

            JsonNode text = normalizer.normalize(root, yaml("{secure: auto, level: high}"), "root");
            assertThat(text.get("secure").asText()).isEqualTo("auto");
            assertThat(text.get("level").asText()).isEqualTo("high");
            assertThatThrownBy(() -> normalizer.normalize(root, yaml("secure: '1'"), "root"))
                    .isInstanceOf(InvalidValueError.class);
        }

        @Test
        @DisplayName("Integer for a float → float")
        void integerForFloat() {
            assertThat(normalize("ratio: 2").get("ratio").isDouble()).isTrue();
        }

        @Test
        @DisplayName("Uncoercible values → InvalidTypeError")
        void uncoercible() {
            assertThatThrownBy(() -> normalize("port: eighty"))
                    .isInstanceOf(InvalidTypeError.class)
                    .hasMessage("Invalid type for path \"app.port\". Expected \"int\", but got \"string \"eighty\"\".");
            assertThatThrownBy(() -> normalize("name: 5"))
                    .isInstanceOf(InvalidTypeError.class)
                    .hasMessage("Invalid type for path \"app.name\". Expected \"string\", but got \"int\".");
            assertThatThrownBy(() -> normalize("debug: yes-please")).isInstanceOf(InvalidTypeError.class);
        }

        @Test
        @DisplayName("Value outside the allowed set → InvalidValueError")
        void notAllowed() {
            assertThatThrownBy(() -> normalize("mode: test"))
                    .isInstanceOf(InvalidValueError.class)
                    .hasMessage("The value \"test\" is not allowed for path \"app.mode\". Permissible values:"
                            + " \"dev\", \"prod\".");
            assertThat(normalize("mode: null").get("mode").isNull()).isTrue();
        }

        @Test
        @DisplayName("Bounds and emptiness")
        void boundsAndEmptiness() {
            assertThatThrownBy(() -> normalize("port: 0"))
                    .isInstanceOf(InvalidValueError.class)
                    .hasMessageContaining("too small");
            assertThatThrownBy(() -> normalize("port: 70000"))
                    .isInstanceOf(InvalidValueError.class)
                    .hasMessageContaining("too big");
            assertThatThrownBy(() -> normalize("handlers: [{id: ''}]"))
                    .isInstanceOf(InvalidValueError.class)
                    .hasMessageContaining("cannot contain an empty value");
        }
    }

    @Test
    @DisplayName("Input is never modified")
    void inputUntouched() {
        JsonNode input = yaml("cache: {enabled: false, app: redis}\ntag: blue");
        JsonNode copy = input.deepCopy();

        normalizer.normalize(app, input, "app");

        assertThat(input).isEqualTo(copy);
    }
}
