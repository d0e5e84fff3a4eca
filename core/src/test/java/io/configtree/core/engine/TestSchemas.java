package io.configtree.core.engine;

import static io.configtree.core.schema.SchemaNode.bool;
import static io.configtree.core.schema.SchemaNode.group;
import static io.configtree.core.schema.SchemaNode.integer;
import static io.configtree.core.schema.SchemaNode.list;
import static io.configtree.core.schema.SchemaNode.map;
import static io.configtree.core.schema.SchemaNode.number;
import static io.configtree.core.schema.SchemaNode.scalar;
import static io.configtree.core.schema.SchemaNode.string;
import static io.configtree.core.schema.SchemaNode.variable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.configtree.core.schema.DefaultValue;
import io.configtree.core.schema.MergePolicy;
import io.configtree.core.schema.SchemaNode;
import io.configtree.core.validation.ConditionalRequirement;
import io.configtree.core.validation.MutualExclusion;
import io.configtree.core.validation.ReferentialIntegrity;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/** Small application schema exercising every node kind and shorthand, shared by the engine tests. */
final class TestSchemas {

    static final String CLUSTER = "cluster";

    private static final YAMLMapper YAML = new YAMLMapper();

    private TestSchemas() {
        // fixtures
    }

    static SchemaNode app() {
        return group("app")
                .alias("tag", "tags")
                .children(
                        string("name").defaultValue("demo"),
                        integer("port").min(1).max(65535).defaultValue(8080),
                        number("ratio").defaultValue(1.0),
                        bool("debug").defaultValue(false),
                        scalar("mode").defaultNull().allowedValues("dev", "prod"),
                        scalar("secret"),
                        list("tags", string("tag")),
                        list("hosts", string("host")).noDeepMerging(),
                        group("cache")
                                .toggle(false)
                                .shorthand("pools")
                                .alias("pool", "pools")
                                .children(
                                        map("pools", list("adapters", string("adapter")).noDeepMerging())
                                                .mergePolicy(MergePolicy.COLLECT)
                                                .defaultKey("default")
                                                .keyAttribute("name")
                                                .defaultValue(DefaultValue.when(
                                                        CLUSTER,
                                                        Map.of("default", List.of("redis")),
                                                        Map.of("default", List.of("filesystem")))),
                                        string("dir")),
                        group("queue")
                                .toggle(false)
                                .children(string("dsn").required(), string("label"), integer("retries").defaultValue(3)),
                        list(
                                "handlers",
                                group("handler")
                                        .shorthand("id")
                                        .singleKeyShorthand("id", "args")
                                        .children(string("id").required().notEmpty(), list("args", variable("arg")))),
                        list("users", group("user").children(string("email"), string("role").defaultValue("reader")))
                                .keyAttribute("email"),
                        map("routes", string("target")),
                        string("default_route").defaultNull(),
                        group("tls")
                                .children(string("cert"), string("ca_bundle"), bool("insecure").defaultValue(false))
                                .invariant(new MutualExclusion("\"tls\"", "ca_bundle", "insecure")))
                .invariant(new ConditionalRequirement("default_route", "routes", "route"))
                .invariant(new ReferentialIntegrity("default_route", "routes", "default route", "routes"))
                .build();
    }

    static JsonNode yaml(String document) {
        try {
            return YAML.readTree(document);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
