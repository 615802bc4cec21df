package dev.shellspec.engine.substitution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks the mocks and stubs active inside one isolated context and resolves names through them.
 *
 * <p>Lookups go through the substitution table first and only then fall back to the declared
 * definition, so stubbing is an insert and unstubbing a removal; nothing is rewritten in place.
 * Instances are not shared between contexts.
 */
public final class SubstitutionRegistry {
    /**
     * Interpreter builtins that cannot be intercepted safely. Injected into every test shell so the
     * runtime library enforces the same list.
     */
    public static final List<String> FORBIDDEN_COMMANDS = List.of(
        "cd", "export", "source", ".", "exit", "eval", "exec", "return", "set", "unset", "readonly",
        "declare", "local", "trap", "builtin", "command", "type", "hash", "read", "echo", "printf",
        "test", "[", "]"
    );

    private static final Set<String> FORBIDDEN = Set.copyOf(FORBIDDEN_COMMANDS);

    private final ProcedureLookup declared;
    private final Map<String, SubstitutionEntry> commands = new LinkedHashMap<>();
    private final Map<String, SubstitutionEntry> procedures = new LinkedHashMap<>();

    public SubstitutionRegistry() {
        this(ProcedureLookup.NONE);
    }

    public SubstitutionRegistry(ProcedureLookup declared) {
        this.declared = Objects.requireNonNull(declared, "declared");
    }

    public static boolean isForbidden(String name) {
        return name != null && FORBIDDEN.contains(name);
    }

    public SubstitutionEntry mockCommand(String name, String body) {
        String operation = SubstitutionKind.COMMAND.shellFunction();
        validate(SubstitutionKind.COMMAND, operation, name, body);
        if (isForbidden(name)) {
            throw new SubstitutionException(SubstitutionException.Reason.FORBIDDEN_TARGET, SubstitutionKind.COMMAND, operation, name);
        }
        if (commands.containsKey(name)) {
            throw new SubstitutionException(SubstitutionException.Reason.ALREADY_MOCKED, SubstitutionKind.COMMAND, operation, name);
        }
        var entry = SubstitutionEntry.command(name, body);
        commands.put(name, entry);
        return entry;
    }

    public SubstitutionEntry stubProcedure(String name, String body) {
        String operation = SubstitutionKind.PROCEDURE.shellFunction();
        validate(SubstitutionKind.PROCEDURE, operation, name, body);
        if (procedures.containsKey(name)) {
            throw new SubstitutionException(SubstitutionException.Reason.ALREADY_STUBBED, SubstitutionKind.PROCEDURE, operation, name);
        }
        var entry = SubstitutionEntry.procedure(name, body, declared.definitionOf(name));
        procedures.put(name, entry);
        return entry;
    }

    public SubstitutionEntry unmockCommand(String name) {
        if (name == null || name.isEmpty()) {
            throw new SubstitutionException(SubstitutionException.Reason.MISSING_NAME, SubstitutionKind.COMMAND, "unmock_command", "");
        }
        var removed = commands.remove(name);
        if (removed == null) {
            throw new SubstitutionException(SubstitutionException.Reason.NOT_MOCKED, SubstitutionKind.COMMAND, "unmock_command", name);
        }
        return removed;
    }

    public SubstitutionEntry unstubProcedure(String name) {
        if (name == null || name.isEmpty()) {
            throw new SubstitutionException(SubstitutionException.Reason.MISSING_NAME, SubstitutionKind.PROCEDURE, "unstub_function", "");
        }
        var removed = procedures.remove(name);
        if (removed == null) {
            throw new SubstitutionException(SubstitutionException.Reason.NOT_STUBBED, SubstitutionKind.PROCEDURE, "unstub_function", name);
        }
        return removed;
    }

    /**
     * Drops every mock and stub. Safe to call repeatedly; returns what was active, commands first.
     */
    public List<SubstitutionEntry> removeAll() {
        if (commands.isEmpty() && procedures.isEmpty()) {
            return List.of();
        }
        List<SubstitutionEntry> removed = new ArrayList<>(commands.values());
        removed.addAll(procedures.values());
        commands.clear();
        procedures.clear();
        return Collections.unmodifiableList(removed);
    }

    public boolean isMocked(String name) {
        return name != null && commands.containsKey(name);
    }

    public boolean isStubbed(String name) {
        return name != null && procedures.containsKey(name);
    }

    public boolean isSubstituted(String name) {
        return isMocked(name) || isStubbed(name);
    }

    public boolean isEmpty() {
        return commands.isEmpty() && procedures.isEmpty();
    }

    /**
     * Active body for a command, or empty when normal {@code PATH} resolution applies.
     */
    public Optional<String> resolveCommand(String name) {
        return Optional.ofNullable(commands.get(name)).map(SubstitutionEntry::body);
    }

    /**
     * Active implementation for a function: the stub body when stubbed, otherwise the declared definition.
     */
    public Optional<String> resolveProcedure(String name) {
        var stub = procedures.get(name);
        if (stub != null) {
            return Optional.of(stub.body());
        }
        return declared.definitionOf(name);
    }

    public List<SubstitutionEntry> entries() {
        List<SubstitutionEntry> all = new ArrayList<>(commands.values());
        all.addAll(procedures.values());
        return Collections.unmodifiableList(all);
    }

    public Map<SubstitutionKind, List<String>> activeByKind() {
        Map<SubstitutionKind, List<String>> byKind = new EnumMap<>(SubstitutionKind.class);
        byKind.put(SubstitutionKind.COMMAND, List.copyOf(commands.keySet()));
        byKind.put(SubstitutionKind.PROCEDURE, List.copyOf(procedures.keySet()));
        return Collections.unmodifiableMap(byKind);
    }

    /**
     * Same two lines {@code list_mocks} prints inside a test shell.
     */
    public String describe() {
        var builder = new StringBuilder();
        activeByKind().forEach((kind, names) -> builder
            .append(kind.label())
            .append(": ")
            .append(names.isEmpty() ? "none" : String.join(" ", names))
            .append('\n'));
        return builder.toString();
    }

    private static void validate(SubstitutionKind kind, String operation, String name, String body) {
        if (name == null || name.isEmpty()) {
            throw new SubstitutionException(SubstitutionException.Reason.MISSING_NAME, kind, operation, "");
        }
        if (body == null || body.isEmpty()) {
            throw new SubstitutionException(SubstitutionException.Reason.MISSING_BODY, kind, operation, name);
        }
    }
}
