package com.foreman.core.template;

import com.foreman.core.model.RawTask;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Standard task lists for the fixed project types.
 * <p>
 * Templates are parameterised by string key/value pairs so they can be fed straight
 * from the command line. Only {@code shed_construction} reads parameters; the others
 * ignore them.
 */
@Component
public class ProjectTemplateCatalog {

    static final int MAX_DIMENSION_FEET = 1000;

    private final Map<String, Function<Map<String, String>, List<RawTask>>> templates = new LinkedHashMap<>();

    public ProjectTemplateCatalog() {
        templates.put("kitchen_remodel", params -> kitchenRemodel());
        templates.put("bathroom_remodel", params -> bathroomRemodel());
        templates.put("new_construction", params -> newConstruction());
        templates.put("addition", params -> addition());
        templates.put("shed_construction", this::shedConstruction);
    }

    public Set<String> names() {
        return templates.keySet();
    }

    public boolean contains(String name) {
        return templates.containsKey(name);
    }

    /**
     * Builds the raw task list for a template.
     *
     * @throws IllegalArgumentException if no template has that name, or a parameter is malformed
     */
    public List<RawTask> create(String name, Map<String, String> params) {
        var factory = templates.get(name);
        if (factory == null) {
            throw new IllegalArgumentException("Unknown project template: " + name
                    + " (available: " + String.join(", ", templates.keySet()) + ")");
        }
        return factory.apply(params != null ? params : Map.of());
    }

    // -- Fixed templates ------------------------------------------------------

    private List<RawTask> kitchenRemodel() {
        return List.of(
                task("1", "Architect", "Design kitchen layout", "planning"),
                task("2", "Permitting", "Apply for building permit", "permitting", "1"),
                task("3", "Carpenter", "Remove old cabinets", "demolition", "2"),
                task("4", "Plumber", "Update plumbing rough-in", "rough_in", "3"),
                task("5", "Electrician", "Update electrical rough-in", "rough_in", "3"),
                task("6", "Permitting", "Schedule rough-in inspection", "inspection", "4", "5"),
                task("7", "Carpenter", "Install new cabinets", "finishing", "6"),
                task("8", "Electrician", "Install lighting fixtures", "finishing", "7"),
                task("9", "Plumber", "Install sink and fixtures", "finishing", "7"),
                task("10", "Painter", "Paint walls", "finishing", "7"),
                task("11", "Permitting", "Final inspection", "final_inspection", "8", "9", "10"));
    }

    private List<RawTask> bathroomRemodel() {
        return List.of(
                task("1", "Architect", "Design bathroom layout", "planning"),
                task("2", "Permitting", "Apply for permits", "permitting", "1"),
                task("3", "Carpenter", "Demolition work", "demolition", "2"),
                task("4", "Plumber", "Rough-in plumbing", "rough_in", "3"),
                task("5", "Electrician", "Rough-in electrical", "rough_in", "3"),
                task("6", "Permitting", "Rough-in inspection", "inspection", "4", "5"),
                task("7", "Carpenter", "Install drywall", "finishing", "6"),
                task("8", "Painter", "Paint and tile work", "finishing", "7"),
                task("9", "Plumber", "Install fixtures", "finishing", "8"),
                task("10", "Electrician", "Install light fixtures", "finishing", "8"),
                task("11", "Permitting", "Final inspection", "final_inspection", "9", "10"));
    }

    private List<RawTask> newConstruction() {
        return List.of(
                task("1", "Architect", "Create architectural plans", "planning"),
                task("2", "Permitting", "Apply for building permits", "permitting", "1"),
                task("3", "Mason", "Pour foundation", "foundation", "2"),
                task("4", "Carpenter", "Frame walls and roof", "framing", "3"),
                task("5", "Roofer", "Install roof", "framing", "4"),
                task("6", "Electrician", "Electrical rough-in", "rough_in", "4"),
                task("7", "Plumber", "Plumbing rough-in", "rough_in", "4"),
                task("8", "HVAC", "HVAC installation", "rough_in", "4"),
                task("9", "Permitting", "Rough-in inspection", "inspection", "6", "7", "8"),
                task("10", "Carpenter", "Install drywall", "finishing", "9"),
                task("11", "Painter", "Paint interior", "finishing", "10"),
                task("12", "Carpenter", "Install flooring and trim", "finishing", "11"),
                task("13", "Electrician", "Install fixtures", "finishing", "10"),
                task("14", "Plumber", "Install fixtures", "finishing", "10"),
                task("15", "Permitting", "Final inspection", "final_inspection", "12", "13", "14"));
    }

    private List<RawTask> addition() {
        return List.of(
                task("1", "Architect", "Design addition plans", "planning"),
                task("2", "Permitting", "Apply for permits", "permitting", "1"),
                task("3", "Mason", "Pour foundation", "foundation", "2"),
                task("4", "Carpenter", "Frame addition", "framing", "3"),
                task("5", "Roofer", "Extend roof", "framing", "4"),
                task("6", "Electrician", "Electrical rough-in", "rough_in", "4"),
                task("7", "Plumber", "Plumbing rough-in", "rough_in", "4"),
                task("8", "HVAC", "Extend HVAC", "rough_in", "4"),
                task("9", "Permitting", "Rough-in inspection", "inspection", "6", "7", "8"),
                task("10", "Carpenter", "Drywall and finishing", "finishing", "9"),
                task("11", "Painter", "Paint", "finishing", "10"),
                task("12", "Permitting", "Final inspection", "final_inspection", "11"));
    }

    // -- Shed -----------------------------------------------------------------

    /**
     * Storage shed. Recognised parameters: {@code has_electrical} (default false),
     * {@code has_foundation} (default true), {@code width}, {@code length} and
     * {@code height} in feet (defaults 10, 12, 8).
     */
    private List<RawTask> shedConstruction(Map<String, String> params) {
        boolean hasElectrical = flag(params, "has_electrical", false);
        boolean hasFoundation = flag(params, "has_foundation", true);
        int width = dimension(params, "width", 10);
        int length = dimension(params, "length", 12);
        int height = dimension(params, "height", 8);

        var tasks = new ArrayList<RawTask>();
        var ids = new IdSequence();

        String planning = ids.next();
        tasks.add(new RawTask(planning, "Architect", "Design shed plans (" + width + "x" + length + " ft)",
                "planning", List.of(),
                ordered("width", width, "length", length, "height", height),
                List.of("blueprints", "specifications")));

        String base = planning;
        if (hasFoundation) {
            base = ids.next();
            tasks.add(new RawTask(base, "Mason", "Pour concrete foundation slab", "foundation",
                    List.of(planning), ordered("area", width * length),
                    List.of("concrete", "rebar", "gravel")));
        }

        String framing = ids.next();
        tasks.add(new RawTask(framing, "Carpenter", "Frame walls and install door/window openings", "framing",
                List.of(base), ordered("wall_count", 4, "door_count", 1, "window_count", 1),
                List.of("2x4 lumber", "plywood", "nails", "door frame", "window frame")));

        String trusses = ids.next();
        tasks.add(new RawTask(trusses, "Carpenter", "Build and install roof trusses", "framing",
                List.of(framing), ordered("span", width),
                List.of("2x4 lumber", "truss plates", "plywood sheathing")));

        String roofing = ids.next();
        tasks.add(new RawTask(roofing, "Roofer", "Install roofing (shingles and underlayment)", "rough_in",
                List.of(trusses), ordered("area", width * length * 1.3),
                List.of("asphalt shingles", "roofing felt", "drip edge", "nails")));

        List<String> sidingDeps = List.of(roofing);
        if (hasElectrical) {
            String electrical = ids.next();
            tasks.add(new RawTask(electrical, "Electrician", "Install electrical wiring, outlet, and light fixture",
                    "rough_in", List.of(framing), ordered("outlets", 1, "lights", 1),
                    List.of("electrical wire", "outlet", "light fixture", "breaker")));
            sidingDeps = List.of(roofing, electrical);
        }

        String siding = ids.next();
        tasks.add(new RawTask(siding, "Carpenter", "Install exterior siding", "finishing",
                sidingDeps, ordered("area", (width + length) * 2 * height),
                List.of("siding panels", "trim", "corner boards", "nails")));

        String doors = ids.next();
        tasks.add(new RawTask(doors, "Carpenter", "Install door and window", "finishing",
                List.of(siding), ordered("door_count", 1, "window_count", 1),
                List.of("entry door", "window", "hinges", "hardware")));

        String painting = ids.next();
        tasks.add(new RawTask(painting, "Painter", "Paint exterior finish", "finishing",
                List.of(doors), ordered("coats", 2),
                List.of("exterior paint", "primer", "brushes", "rollers")));

        tasks.add(new RawTask(ids.next(), "Carpenter", "Final walkthrough and cleanup", "final_inspection",
                List.of(painting),
                ordered("checklist", List.of("doors close properly", "roof is sealed", "paint is dry")),
                List.of()));

        return List.copyOf(tasks);
    }

    // -- Helpers --------------------------------------------------------------

    private static RawTask task(String id, String owner, String description, String phase, String... deps) {
        return new RawTask(id, owner, description, phase, List.of(deps));
    }

    private static Map<String, Object> ordered(Object... keyValues) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private static boolean flag(Map<String, String> params, String key, boolean defaultValue) {
        String value = params.get(key);
        if (value == null || value.isBlank()) return defaultValue;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "1" -> true;
            case "false", "no", "0" -> false;
            default -> throw new IllegalArgumentException("Parameter " + key + " must be true or false, got: " + value);
        };
    }

    private static int dimension(Map<String, String> params, String key, int defaultValue) {
        String value = params.get(key);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0 || parsed > MAX_DIMENSION_FEET) {
                throw new IllegalArgumentException("Parameter " + key + " must be between 1 and "
                        + MAX_DIMENSION_FEET + " feet, got: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + key + " must be a whole number of feet, got: " + value, e);
        }
    }

    private static final class IdSequence {
        private int next = 1;

        String next() {
            return String.valueOf(next++);
        }
    }
}
