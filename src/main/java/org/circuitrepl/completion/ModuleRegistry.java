package org.circuitrepl.completion;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known modules and board pin sets, loaded from a HOCON resource.
 * <p>
 * Resource structure:
 * <pre>
 * modules = [
 *   { name = "digitalio", description = "...",
 *     members = [ { name = "DigitalInOut", kind = "class", description = "..." } ] }
 * ]
 * boards = [
 *   { id = "default", name = "...", pins = [ { name = "D0", capabilities = ["digital"] } ] }
 * ]
 * </pre>
 */
public final class ModuleRegistry {

    public static final String DEFAULT_RESOURCE = "modules.conf";
    public static final String DEFAULT_BOARD = "default";

    public record Member(String name, String kind, String description) {
    }

    public record Module(String name, String description, List<Member> members) {
    }

    public record BoardPin(String name, List<String> capabilities) {
    }

    public record Board(String id, String displayName, List<BoardPin> pins) {
    }

    private final Map<String, Module> modules;
    private final Map<String, Board> boards;

    public ModuleRegistry(final Collection<Module> modules, final Collection<Board> boards) {
        this.modules = new LinkedHashMap<>();
        modules.forEach(module -> this.modules.put(module.name(), module));
        this.boards = new LinkedHashMap<>();
        boards.forEach(board -> this.boards.put(board.id(), board));
    }

    public static ModuleRegistry loadDefault() {
        return load(ConfigFactory.parseResources(DEFAULT_RESOURCE).resolve());
    }

    public static ModuleRegistry load(final Config config) {
        final List<Module> modules = config.getConfigList("modules").stream()
                .map(ModuleRegistry::toModule)
                .toList();
        final List<Board> boards = config.hasPath("boards")
                ? config.getConfigList("boards").stream().map(ModuleRegistry::toBoard).toList()
                : List.of();
        return new ModuleRegistry(modules, boards);
    }

    public Collection<Module> modules() {
        return Collections.unmodifiableCollection(modules.values());
    }

    public Optional<Module> module(final String name) {
        return Optional.ofNullable(modules.get(name));
    }

    /**
     * Returns the board with the given id, or the default board if the id is unknown.
     */
    public Optional<Board> board(final String id) {
        final Board board = boards.get(id);
        return board != null ? Optional.of(board) : Optional.ofNullable(boards.get(DEFAULT_BOARD));
    }

    private static Module toModule(final Config c) {
        final List<Member> members = c.hasPath("members")
                ? c.getConfigList("members").stream()
                    .map(m -> new Member(m.getString("name"), m.getString("kind"), optionalString(m, "description")))
                    .toList()
                : List.of();
        return new Module(c.getString("name"), optionalString(c, "description"), members);
    }

    private static Board toBoard(final Config c) {
        final List<BoardPin> pins = c.getConfigList("pins").stream()
                .map(p -> new BoardPin(p.getString("name"),
                        p.hasPath("capabilities") ? p.getStringList("capabilities") : List.of()))
                .toList();
        return new Board(c.getString("id"), optionalString(c, "name"), pins);
    }

    private static String optionalString(final Config c, final String path) {
        return c.hasPath(path) ? c.getString(path) : "";
    }
}
