package io.configtree.framework;

import static io.configtree.core.schema.SchemaNode.bool;
import static io.configtree.core.schema.SchemaNode.group;
import static io.configtree.core.schema.SchemaNode.integer;
import static io.configtree.core.schema.SchemaNode.list;
import static io.configtree.core.schema.SchemaNode.map;
import static io.configtree.core.schema.SchemaNode.number;
import static io.configtree.core.schema.SchemaNode.scalar;
import static io.configtree.core.schema.SchemaNode.string;
import static io.configtree.core.schema.SchemaNode.variable;
import static io.configtree.framework.FrameworkCapability.DOCTRINE_DBAL;
import static io.configtree.framework.FrameworkCapability.FULL_STACK;
import static io.configtree.framework.FrameworkCapability.HTTP_CLIENT;
import static io.configtree.framework.FrameworkCapability.MAILER;
import static io.configtree.framework.FrameworkCapability.MESSENGER;
import static io.configtree.framework.FrameworkCapability.NOTIFIER;
import static io.configtree.framework.FrameworkCapability.RATE_LIMITER;
import static io.configtree.framework.FrameworkCapability.SEMAPHORE_STORE;
import static io.configtree.framework.FrameworkCapability.UID;

import io.configtree.core.engine.ConfigProcessor;
import io.configtree.core.schema.Capabilities;
import io.configtree.core.schema.DefaultValue;
import io.configtree.core.schema.MergePolicy;
import io.configtree.core.schema.SchemaNode;
import io.configtree.core.validation.ConditionalRequirement;
import io.configtree.core.validation.MutualExclusion;
import io.configtree.core.validation.ReferentialIntegrity;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration tree of the web-application framework bundle, rooted at {@value #ROOT}.
 *
 * <p>
 * Each feature section is a group; most are toggle groups whose default {@code enabled} state
 * depends on the {@link FrameworkCapability capabilities} handed to the processor. The schema is
 * immutable and can be shared between processors.
 */
public final class FrameworkSchema {

    private static final Logger LOG = LoggerFactory.getLogger(FrameworkSchema.class);

    /** Name of the root group; prefixes every error path. */
    public static final String ROOT = "framework";

    /** Characters a session name cannot contain, as they are rewritten in request parameters. */
    static final String SESSION_NAME_PATTERN = "[^.\\[\\]=+]*";

    private static final DefaultValue UNLESS_FULL_STACK = DefaultValue.flag(c -> !c.has(FULL_STACK));

    private FrameworkSchema() {
        // utility class
    }

    /** Builds the schema. */
    public static SchemaNode create() {
        SchemaNode root = group(ROOT)
                .alias("exception", "exceptions")
                .children(
                        bool("http_method_override").defaultValue(true),
                        scalar("ide").defaultNull(),
                        string("default_locale").defaultValue("en"),
                        list("enabled_locales", string("locale")),
                        bool("set_locale_from_accept_language").defaultValue(false),
                        bool("set_content_language_from_locale").defaultValue(false),
                        scalar("secret"),
                        list("trusted_hosts", string("host")),
                        list("trusted_headers", string("header"))
                                .noDeepMerging()
                                .defaultValue(List.of("x-forwarded-for", "x-forwarded-port", "x-forwarded-proto")),
                        group("csrf_protection").toggle(false),
                        form(),
                        group("esi").toggle(false),
                        group("ssi").toggle(false),
                        fragments(),
                        profiler(),
                        translator(),
                        validation(),
                        annotations(),
                        serializer(),
                        propertyAccess(),
                        group("property_info").toggle(UNLESS_FULL_STACK),
                        router(),
                        session(),
                        request(),
                        assets(),
                        cache(),
                        workflows(),
                        phpErrors(),
                        group("web_link").toggle(UNLESS_FULL_STACK),
                        lock(),
                        messenger(),
                        bool("disallow_search_engine_index").defaultValue(true),
                        httpClient(),
                        mailer(),
                        notifier(),
                        string("error_controller").defaultValue("error_controller"),
                        secrets(),
                        httpCache(),
                        rateLimiter(),
                        uid(),
                        exceptions())
                .build();
        LOG.debug("Framework schema built: sections={}", root.children().size());
        return root;
    }

    /** A processor applying this schema with the given capabilities. */
    public static ConfigProcessor processor(Capabilities capabilities) {
        return new ConfigProcessor(create(), capabilities);
    }

    private static DefaultValue unlessFullStackAnd(String capability) {
        return DefaultValue.flag(c -> !c.has(FULL_STACK) && c.has(capability));
    }

    // --- Sections ---

    private static SchemaNode.Builder form() {
        return group("form")
                .toggle(UNLESS_FULL_STACK)
                .children(
                        group("csrf_protection")
                                .children(
                                        bool("enabled").defaultNull(),
                                        string("field_name").defaultValue("_token")),
                        bool("legacy_error_messages").defaultValue(true));
    }

    private static SchemaNode.Builder fragments() {
        return group("fragments")
                .toggle(false)
                .children(
                        string("hinclude_default_template").defaultNull(),
                        string("path").defaultValue("/_fragment"));
    }

    private static SchemaNode.Builder profiler() {
        return group("profiler")
                .toggle(false)
                .children(
                        bool("collect").defaultValue(true),
                        string("collect_parameter").defaultNull(),
                        bool("only_exceptions").defaultValue(false),
                        bool("only_master_requests").defaultValue(false),
                        bool("only_main_requests").defaultValue(false),
                        string("dsn").defaultValue("file:%kernel.cache_dir%/profiler"));
    }

    private static SchemaNode.Builder translator() {
        return group("translator")
                .toggle(UNLESS_FULL_STACK)
                .alias("fallback", "fallbacks")
                .alias("path", "paths")
                .alias("enabled_locale", "enabled_locales")
                .alias("provider", "providers")
                .children(
                        list("fallbacks", string("locale")),
                        bool("logging").defaultValue(false),
                        string("formatter").defaultValue("translator.formatter.default"),
                        string("cache_dir").defaultValue("%kernel.cache_dir%/translations"),
                        string("default_path").defaultValue("%kernel.project_dir%/translations"),
                        list("paths", string("path")),
                        list("enabled_locales", string("locale")),
                        group("pseudo_localization")
                                .toggle(false)
                                .children(
                                        bool("accents").defaultValue(true),
                                        number("expansion_factor").min(1).defaultValue(1.0),
                                        bool("brackets").defaultValue(true),
                                        bool("parse_html").defaultValue(false),
                                        list("localizable_html_attributes", string("attribute"))),
                        map(
                                "providers",
                                group("provider")
                                        .alias("domain", "domains")
                                        .alias("locale", "locales")
                                        .children(
                                                string("dsn"),
                                                list("domains", string("domain")),
                                                list("locales", string("locale")))));
    }

    private static SchemaNode.Builder validation() {
        return group("validation")
                .toggle(UNLESS_FULL_STACK)
                .children(
                        bool("enable_annotations").defaultValue(UNLESS_FULL_STACK),
                        list("static_method", string("method")).defaultValue(List.of("loadValidatorMetadata")),
                        string("translation_domain").defaultValue("validators"),
                        group("mapping")
                                .alias("path", "paths")
                                .children(list("paths", string("path"))),
                        map("auto_mapping", list("services", string("service"))),
                        group("not_compromised_password")
                                .toggle(true)
                                .children(string("endpoint").defaultNull()));
    }

    private static SchemaNode.Builder annotations() {
        return group("annotations")
                .toggle(true)
                .children(
                        string("cache").defaultValue("php_array"),
                        string("file_cache_dir").defaultValue("%kernel.cache_dir%/annotations"),
                        bool("debug").defaultValue(true));
    }

    private static SchemaNode.Builder serializer() {
        return group("serializer")
                .toggle(UNLESS_FULL_STACK)
                .children(
                        bool("enable_annotations").defaultValue(UNLESS_FULL_STACK),
                        group("mapping")
                                .alias("path", "paths")
                                .children(list("paths", string("path"))),
                        map("default_context", variable("value")));
    }

    private static SchemaNode.Builder propertyAccess() {
        return group("property_access")
                .toggle(true)
                .children(
                        bool("magic_call").defaultValue(false),
                        bool("magic_get").defaultValue(true),
                        bool("magic_set").defaultValue(true),
                        bool("throw_exception_on_invalid_index").defaultValue(false),
                        bool("throw_exception_on_invalid_property_path").defaultValue(true));
    }

    private static SchemaNode.Builder router() {
        return group("router")
                .toggle(false)
                .children(
                        string("resource").required(),
                        string("type"),
                        string("default_uri").defaultNull(),
                        integer("http_port").defaultValue(80),
                        integer("https_port").defaultValue(443),
                        scalar("strict_requirements").defaultValue(true),
                        bool("utf8").defaultNull());
    }

    private static SchemaNode.Builder session() {
        return group("session")
                .toggle(false)
                .children(
                        string("storage_id").defaultValue("session.storage.native"),
                        string("storage_factory_id").defaultNull(),
                        string("handler_id").defaultValue("session.handler.native_file"),
                        scalar("name").pattern(SESSION_NAME_PATTERN, "Session name %s contains illegal character(s)."),
                        integer("cookie_lifetime").min(0),
                        string("cookie_path"),
                        string("cookie_domain"),
                        scalar("cookie_secure").allowedValues(true, false, "auto"),
                        bool("cookie_httponly").defaultValue(true),
                        scalar("cookie_samesite").defaultNull().allowedValues(null, "lax", "strict", "none"),
                        bool("use_cookies"),
                        integer("gc_divisor").min(1),
                        integer("gc_probability").min(0).defaultValue(1),
                        string("gc_maxlifetime"),
                        string("save_path").defaultValue("%kernel.cache_dir%/sessions"),
                        integer("metadata_update_threshold").min(0).defaultValue(0));
    }

    private static SchemaNode.Builder request() {
        return group("request")
                .toggle(false)
                .alias("format", "formats")
                .children(map("formats", list("mime_types", string("mime_type"))));
    }

    private static SchemaNode.Builder assets() {
        return group("assets")
                .toggle(UNLESS_FULL_STACK)
                .alias("base_url", "base_urls")
                .alias("package", "packages")
                .children(
                        bool("strict_mode").defaultValue(false),
                        string("version_strategy").defaultNull(),
                        scalar("version").defaultNull(),
                        string("version_format").defaultValue("%%s?%%s"),
                        string("json_manifest_path").defaultNull(),
                        string("base_path").defaultValue(""),
                        list("base_urls", string("url")),
                        map(
                                "packages",
                                group("package")
                                        .alias("base_url", "base_urls")
                                        .children(
                                                bool("strict_mode").defaultValue(false),
                                                string("version_strategy").defaultNull(),
                                                scalar("version"),
                                                string("version_format").defaultNull(),
                                                string("json_manifest_path").defaultNull(),
                                                string("base_path").defaultValue(""),
                                                list("base_urls", string("url")))
                                        .invariant(new MutualExclusion(
                                                "\"assets\" packages", "version_strategy", "version",
                                                "json_manifest_path"))))
                .invariant(new MutualExclusion("\"assets\"", "version_strategy", "version", "json_manifest_path"));
    }

    private static SchemaNode.Builder cache() {
        return group("cache")
                .alias("pool", "pools")
                .children(
                        string("prefix_seed").defaultValue("_%kernel.project_dir%.%kernel.container_class%"),
                        string("app").defaultValue("cache.adapter.filesystem"),
                        string("system").defaultValue("cache.adapter.system"),
                        string("directory").defaultValue("%kernel.cache_dir%/pools/app"),
                        string("default_redis_provider").defaultValue("redis://localhost"),
                        string("default_memcached_provider").defaultValue("memcached://localhost"),
                        string("default_doctrine_dbal_provider").defaultValue("database_connection"),
                        string("default_pdo_provider")
                                .defaultValue(DefaultValue.when(DOCTRINE_DBAL, "database_connection", null)),
                        map(
                                "pools",
                                group("pool")
                                        .alias("adapter", "adapters")
                                        .children(
                                                list("adapters", string("adapter")).defaultValue(List.of("cache.app")),
                                                scalar("tags").defaultNull(),
                                                bool("public").defaultValue(false),
                                                scalar("default_lifetime").defaultNull(),
                                                string("provider").defaultNull(),
                                                string("early_expiration_message_bus").defaultNull(),
                                                string("clearer").defaultNull())));
    }

    private static SchemaNode.Builder workflows() {
        return group("workflows")
                .toggle(false)
                .shorthand("workflows")
                .alias("workflow", "workflows")
                .children(map(
                        "workflows",
                        group("workflow")
                                .alias("support", "supports")
                                .alias("place", "places")
                                .alias("transition", "transitions")
                                .children(
                                        string("type")
                                                .defaultValue("state_machine")
                                                .allowedValues("workflow", "state_machine"),
                                        group("audit_trail").toggle(false),
                                        group("marking_store")
                                                .children(
                                                        string("type").allowedValues("method"),
                                                        string("property"),
                                                        string("service")),
                                        list("supports", string("class")),
                                        string("support_strategy"),
                                        list("initial_marking", string("place")),
                                        list("places", variable("place")),
                                        list("transitions", variable("transition")))
                                .invariant(new MutualExclusion(
                                        "\"workflows\" definitions", "supports", "support_strategy"))));
    }

    private static SchemaNode.Builder phpErrors() {
        return group("php_errors")
                .children(
                        scalar("log").defaultValue(true),
                        bool("throw").defaultValue(true));
    }

    private static SchemaNode.Builder lock() {
        return group("lock")
                .toggle(UNLESS_FULL_STACK)
                .shorthand("resources")
                .alias("resource", "resources")
                .children(map("resources", list("stores", string("store")).noDeepMerging())
                        .mergePolicy(MergePolicy.COLLECT)
                        .defaultKey("default")
                        .keyAttribute("name")
                        .defaultValue(DefaultValue.when(
                                SEMAPHORE_STORE,
                                Map.of("default", List.of("semaphore")),
                                Map.of("default", List.of("flock")))));
    }

    private static SchemaNode.Builder messenger() {
        return group("messenger")
                .toggle(unlessFullStackAnd(MESSENGER))
                .alias("transport", "transports")
                .alias("bus", "buses")
                .children(
                        map("routing", group("route").shorthand("senders").alias("sender", "senders")
                                .children(list("senders", string("sender")))),
                        group("serializer")
                                .children(
                                        string("default_serializer")
                                                .defaultValue("messenger.transport.native_php_serializer"),
                                        group("symfony_serializer")
                                                .children(
                                                        string("format").defaultValue("json"),
                                                        map("context", variable("value")))),
                        map(
                                "transports",
                                group("transport")
                                        .shorthand("dsn")
                                        .children(
                                                string("dsn"),
                                                string("serializer").defaultNull(),
                                                map("options", variable("value")),
                                                string("failure_transport").defaultNull(),
                                                group("retry_strategy")
                                                        .children(
                                                                string("service").defaultNull(),
                                                                integer("max_retries").min(0).defaultValue(3),
                                                                integer("delay").min(0).defaultValue(1000),
                                                                number("multiplier").min(1).defaultValue(2.0),
                                                                integer("max_delay").min(0).defaultValue(0)))),
                        string("failure_transport").defaultNull(),
                        bool("reset_on_message").defaultNull(),
                        string("default_bus").defaultNull(),
                        map(
                                "buses",
                                group("bus")
                                        .children(
                                                scalar("default_middleware")
                                                        .defaultValue(true)
                                                        .allowedValues(true, false, "allow_no_handlers"),
                                                list("middleware", group("middleware")
                                                                .shorthand("id")
                                                                .singleKeyShorthand("id", "arguments")
                                                                .alias("argument", "arguments")
                                                                .children(
                                                                        string("id").required().notEmpty(),
                                                                        list("arguments", variable("argument"))))
                                                        .noDeepMerging()))
                                .defaultValue(Map.of(
                                        "messenger.bus.default",
                                        Map.of("default_middleware", true, "middleware", List.of()))))
                .invariant(new ConditionalRequirement("default_bus", "buses", "bus"))
                .invariant(new ReferentialIntegrity("default_bus", "buses", "default bus", "buses"));
    }

    private static SchemaNode.Builder httpClient() {
        return group("http_client")
                .toggle(unlessFullStackAnd(HTTP_CLIENT))
                .alias("scoped_client", "scoped_clients")
                .children(
                        integer("max_host_connections").min(1),
                        map(
                                "scoped_clients",
                                group("scoped_client")
                                        .alias("header", "headers")
                                        .children(
                                                string("scope"),
                                                string("base_uri"),
                                                string("auth_basic"),
                                                string("auth_bearer"),
                                                map("headers", scalar("value")),
                                                integer("max_redirects"),
                                                string("http_version"),
                                                number("timeout"),
                                                number("max_duration"))
                                        .invariant(new MutualExclusion(
                                                "\"http_client\" scoped clients", "auth_basic", "auth_bearer"))));
    }

    private static SchemaNode.Builder mailer() {
        return group("mailer")
                .toggle(unlessFullStackAnd(MAILER))
                .alias("transport", "transports")
                .alias("header", "headers")
                .children(
                        string("message_bus").defaultNull(),
                        string("dsn").defaultNull(),
                        map("transports", string("dsn")),
                        map("headers", variable("value")))
                .invariant(new MutualExclusion("\"mailer\"", "dsn", "transports"));
    }

    private static SchemaNode.Builder notifier() {
        return group("notifier")
                .toggle(unlessFullStackAnd(NOTIFIER))
                .alias("chatter_transport", "chatter_transports")
                .alias("texter_transport", "texter_transports")
                .alias("admin_recipient", "admin_recipients")
                .children(
                        map("chatter_transports", string("dsn")),
                        map("texter_transports", string("dsn")),
                        bool("notification_on_failed_messages").defaultValue(false),
                        map("channel_policy", list("channels", string("channel"))),
                        list(
                                        "admin_recipients",
                                        group("recipient")
                                                .children(
                                                        string("email").required().notEmpty(),
                                                        string("phone").defaultValue("")))
                                .keyAttribute("email"));
    }

    private static SchemaNode.Builder secrets() {
        return group("secrets")
                .toggle(true)
                .children(
                        string("vault_directory")
                                .defaultValue("%kernel.project_dir%/config/secrets/%kernel.runtime_environment%")
                                .notEmpty(),
                        string("local_dotenv_file").defaultValue("%kernel.project_dir%/.env.%kernel.environment%.local"),
                        string("decryption_env_var").defaultValue("base64:default::SYMFONY_DECRYPTION_SECRET"));
    }

    private static SchemaNode.Builder httpCache() {
        return group("http_cache")
                .toggle(false)
                .alias("private_header", "private_headers")
                .children(
                        scalar("debug").defaultValue("%kernel.debug%"),
                        string("trace_level").allowedValues("none", "short", "full"),
                        string("trace_header"),
                        integer("default_ttl").min(0),
                        list("private_headers", string("header")),
                        bool("allow_reload"),
                        bool("allow_revalidate"),
                        integer("stale_while_revalidate").min(0),
                        integer("stale_if_error").min(0));
    }

    private static SchemaNode.Builder rateLimiter() {
        return group("rate_limiter")
                .toggle(unlessFullStackAnd(RATE_LIMITER))
                .shorthand("limiters")
                .alias("limiter", "limiters")
                .children(map(
                        "limiters",
                        group("limiter")
                                .children(
                                        string("lock_factory").defaultValue("lock.factory"),
                                        string("storage_service").defaultNull(),
                                        string("cache_pool").defaultValue("cache.rate_limiter"),
                                        string("policy")
                                                .required()
                                                .allowedValues("fixed_window", "token_bucket", "sliding_window",
                                                        "no_limit"),
                                        integer("limit").min(1),
                                        string("interval"),
                                        group("rate")
                                                .children(
                                                        string("interval"),
                                                        integer("amount").min(1).defaultValue(1)))));
    }

    private static SchemaNode.Builder uid() {
        return group("uid")
                .toggle(unlessFullStackAnd(UID))
                .children(
                        integer("default_uuid_version").defaultValue(6).allowedValues(6, 4, 1),
                        integer("name_based_uuid_version").defaultValue(5).allowedValues(5, 3),
                        string("name_based_uuid_namespace"),
                        integer("time_based_uuid_version").defaultValue(6).allowedValues(6, 1),
                        string("time_based_uuid_node"));
    }

    private static SchemaNode.Builder exceptions() {
        return map(
                "exceptions",
                group("exception")
                        .children(
                                string("log_level")
                                        .defaultNull()
                                        .allowedValues("debug", "info", "notice", "warning", "error", "critical",
                                                "alert", "emergency"),
                                integer("status_code").defaultNull().min(100).max(599)));
    }
}
