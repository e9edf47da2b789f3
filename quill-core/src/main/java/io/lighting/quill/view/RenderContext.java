package io.lighting.quill.view;

import io.lighting.quill.value.Value;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-render state: the model, the framework namespaces, the loop stack and helper locals.
 * <p>
 * Instances are created for a single render call and must not be shared between threads.
 */
public final class RenderContext {
    private final Value data;
    private final Value globalRepository;
    private final Value repository;
    private final Value session;
    private final Value query;
    private final Value user;
    private final Map<String, String> config;
    private final Value conf;
    private final String url;
    private final String hostname;
    private final TemplateFunctions functions;
    private final Translator translator;
    private final Deque<LoopContext> loopStack = new ArrayDeque<>();
    private Map<String, Value> locals = new HashMap<>();
    private final Map<String, List<TemplateNode>> sections = new HashMap<>();
    private final Map<String, Template.Helper> helpers = new HashMap<>();
    private int includeDepth;

    private RenderContext(Builder builder) {
        this.data = builder.data;
        this.globalRepository = builder.globalRepository;
        this.repository = builder.repository;
        this.session = builder.session;
        this.query = builder.query;
        this.user = builder.user;
        this.config = Map.copyOf(builder.config);
        this.conf = builder.conf;
        this.url = builder.url;
        this.hostname = builder.hostname;
        this.functions = builder.functions;
        this.translator = builder.translator;
    }

    public static Builder builder(Value data) {
        return new Builder(data);
    }

    public static RenderContext of(Value data) {
        return builder(data).build();
    }

    /**
     * Creates a context for a partial rendered with its own model. Shared namespaces,
     * functions, translator and include depth carry over; loops, locals, sections and
     * helpers do not.
     */
    public RenderContext forModel(Value model) {
        RenderContext child = new Builder(model)
            .globalRepository(globalRepository)
            .repository(repository)
            .session(session)
            .query(query)
            .user(user)
            .config(config)
            .conf(conf)
            .url(url)
            .hostname(hostname)
            .functions(functions)
            .translator(translator)
            .build();
        child.includeDepth = includeDepth;
        return child;
    }

    /**
     * Resolves a possibly dotted name. The first segment is looked up in reserved names,
     * then the loop stack (innermost first), then helper locals, then the model.
     */
    public Value resolveVariable(String name) {
        Objects.requireNonNull(name, "name");
        int dot = name.indexOf('.');
        String head = dot < 0 ? name : name.substring(0, dot);
        String rest = dot < 0 ? null : name.substring(dot + 1);

        Value reserved = resolveReserved(head, rest);
        if (reserved != null) {
            return reserved;
        }
        for (LoopContext loop : loopStack) {
            if (loop.itemName().equals(head)) {
                return nested(loop.current(), rest);
            }
        }
        Value local = locals.get(head);
        if (local != null) {
            return nested(local, rest);
        }
        if (data instanceof Value.ObjectValue object && object.containsKey(head)) {
            return nested(object.get(head), rest);
        }
        return Value.NULL;
    }

    private Value resolveReserved(String head, String rest) {
        switch (head) {
            case "index":
                LoopContext loop = loopStack.peek();
                return loop == null ? null : nested(Value.of(loop.index()), rest);
            case "CONF":
                return nested(conf, rest);
            case "repository":
            case "R":
                return nested(repository, rest);
            case "session":
                return nested(session, rest);
            case "flash":
                return nested(TemplateExpression.property(session, "flash"), rest);
            case "query":
                return nested(query, rest);
            case "user":
                return nested(user, rest);
            case "url":
                return Value.of(url);
            case "hostname":
                return Value.of(hostname);
            case "model":
            case "M":
                return nested(data, rest);
            case "APP":
            case "MAIN":
                return nested(globalRepository, rest);
            case "csrf_token":
                String tokenId = rest == null ? "_csrf_token" : rest;
                return TemplateExpression.property(TemplateExpression.property(session, tokenId), "token");
            case "root":
                Value root = TemplateExpression.property(conf, "default_root");
                return root.isNull() ? Value.of("") : root;
            default:
                return null;
        }
    }

    private static Value nested(Value value, String path) {
        return path == null ? value : getNestedValue(value, path);
    }

    /**
     * Walks a dotted path through object keys, array indexes and {@code length}/{@code size}.
     */
    public static Value getNestedValue(Value value, String path) {
        Objects.requireNonNull(path, "path");
        Value current = value == null ? Value.NULL : value;
        if (path.isEmpty()) {
            return current;
        }
        for (String segment : path.split("\\.")) {
            if (current.isNull()) {
                return Value.NULL;
            }
            current = TemplateExpression.property(current, segment);
        }
        return current;
    }

    public Value callFunction(String name, List<Value> args) {
        if (functions == null) {
            return Value.NULL;
        }
        return functions.call(name, args, this);
    }

    void pushLoop(LoopContext loop) {
        loopStack.push(loop);
    }

    void popLoop() {
        loopStack.pop();
    }

    public int loopDepth() {
        return loopStack.size();
    }

    Value currentLoopIndex() {
        LoopContext loop = loopStack.peek();
        return loop == null ? Value.NULL : Value.of(loop.index());
    }

    /**
     * Replaces the helper locals, returning the previous map for {@link #restoreLocals(Map)}.
     */
    Map<String, Value> bindLocals(Map<String, Value> bindings) {
        Map<String, Value> previous = locals;
        Map<String, Value> next = new HashMap<>(previous);
        next.putAll(bindings);
        locals = next;
        return previous;
    }

    void restoreLocals(Map<String, Value> previous) {
        locals = previous;
    }

    /**
     * Registers sections. Existing entries win, so sections injected from a child
     * template are not replaced by the layout's own definitions.
     */
    void addSections(Map<String, List<TemplateNode>> definitions) {
        definitions.forEach(sections::putIfAbsent);
    }

    List<TemplateNode> section(String name) {
        return sections.get(name);
    }

    Map<String, List<TemplateNode>> sections() {
        return Collections.unmodifiableMap(sections);
    }

    void addHelpers(Map<String, Template.Helper> definitions) {
        definitions.forEach(helpers::putIfAbsent);
    }

    Template.Helper helper(String name) {
        return helpers.get(name);
    }

    Map<String, Template.Helper> helpers() {
        return Collections.unmodifiableMap(helpers);
    }

    int enterInclude() {
        return ++includeDepth;
    }

    void exitInclude() {
        includeDepth--;
    }

    public Value data() {
        return data;
    }

    public Value session() {
        return session;
    }

    public Value conf() {
        return conf;
    }

    public String config(String key) {
        return config.getOrDefault(key, "");
    }

    public String url() {
        return url;
    }

    public String hostname() {
        return hostname;
    }

    public Translator translator() {
        return translator;
    }

    public TemplateFunctions functions() {
        return functions;
    }

    Value namespace(Namespace namespace) {
        return switch (namespace) {
            case REPOSITORY, R -> repository;
            case SESSION -> session;
            case QUERY -> query;
            case USER -> user;
            case APP, MAIN -> globalRepository;
            case MODEL, M -> data;
            case CONF -> conf;
        };
    }

    public static final class Builder {
        private final Value data;
        private Value globalRepository = Value.NULL;
        private Value repository = Value.NULL;
        private Value session = Value.NULL;
        private Value query = Value.NULL;
        private Value user = Value.NULL;
        private Map<String, String> config = Map.of();
        private Value conf = Value.NULL;
        private String url = "";
        private String hostname = "";
        private TemplateFunctions functions = TemplateFunctions.standard();
        private Translator translator;

        private Builder(Value data) {
            this.data = data == null ? Value.NULL : data;
        }

        public Builder globalRepository(Value globalRepository) {
            this.globalRepository = orNull(globalRepository);
            return this;
        }

        public Builder repository(Value repository) {
            this.repository = orNull(repository);
            return this;
        }

        public Builder session(Value session) {
            this.session = orNull(session);
            return this;
        }

        public Builder query(Value query) {
            this.query = orNull(query);
            return this;
        }

        public Builder user(Value user) {
            this.user = orNull(user);
            return this;
        }

        public Builder config(Map<String, String> config) {
            this.config = config == null ? Map.of() : config;
            return this;
        }

        public Builder conf(Value conf) {
            this.conf = orNull(conf);
            return this;
        }

        public Builder url(String url) {
            this.url = url == null ? "" : url;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname == null ? "" : hostname;
            return this;
        }

        public Builder functions(TemplateFunctions functions) {
            this.functions = functions;
            return this;
        }

        public Builder translator(Translator translator) {
            this.translator = translator;
            return this;
        }

        public RenderContext build() {
            return new RenderContext(this);
        }

        private static Value orNull(Value value) {
            return value == null ? Value.NULL : value;
        }
    }
}
