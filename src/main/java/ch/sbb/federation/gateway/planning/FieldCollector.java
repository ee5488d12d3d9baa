package ch.sbb.federation.gateway.planning;

import ch.sbb.federation.gateway.error.PlanningException;
import ch.sbb.federation.gateway.model.ComposedSchema;
import graphql.language.Argument;
import graphql.language.BooleanValue;
import graphql.language.Directive;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.TypeName;
import graphql.language.Value;
import graphql.language.VariableReference;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattens fragment spreads and inline fragments into fields grouped by response key,
 * for one concrete runtime type.
 *
 * <p>With variables, {@code @skip} and {@code @include} are evaluated and skipped fields
 * dropped. Without variables (when planning) the directives are kept on the fields, and
 * directives of enclosing fragments are pushed down onto them, so the plan stays valid for
 * every variable value.</p>
 */
public final class FieldCollector {

    private static final Set<String> CONDITIONAL_DIRECTIVES = Set.of("skip", "include");

    private final ComposedSchema schema;
    private final Map<String, FragmentDefinition> fragments;
    private final Map<String, Object> variables;

    public FieldCollector(ComposedSchema schema, Map<String, FragmentDefinition> fragments,
                          Map<String, Object> variables) {
        this.schema = schema;
        this.fragments = fragments;
        this.variables = variables;
    }

    /**
     * Collect the fields of a selection set that apply to {@code runtimeType}.
     */
    public Map<String, List<Field>> collect(SelectionSet selectionSet, String runtimeType) {
        Map<String, List<Field>> fields = new LinkedHashMap<>();
        if (selectionSet != null) {
            collect(selectionSet, runtimeType, List.of(), new HashSet<>(), fields);
        }
        return fields;
    }

    /**
     * Collect the merged sub-selections of several fields sharing one response key.
     */
    public Map<String, List<Field>> collectSubfields(List<Field> fields, String runtimeType) {
        Map<String, List<Field>> result = new LinkedHashMap<>();
        for (Field field : fields) {
            if (field.getSelectionSet() != null) {
                collect(field.getSelectionSet(), runtimeType, List.of(), new HashSet<>(), result);
            }
        }
        return result;
    }

    private void collect(SelectionSet selectionSet, String runtimeType, List<Directive> inherited,
                         Set<String> visitedFragments, Map<String, List<Field>> fields) {
        for (Selection<?> selection : selectionSet.getSelections()) {
            if (selection instanceof Field field) {
                if (!included(field.getDirectives())) {
                    continue;
                }
                Field collected = inherited.isEmpty() ? field : field.transform(b -> b.directives(
                    concat(inherited, field.getDirectives())));
                fields.computeIfAbsent(responseKey(field), k -> new ArrayList<>()).add(collected);
            } else if (selection instanceof InlineFragment inline) {
                if (!included(inline.getDirectives()) || !applies(inline.getTypeCondition(), runtimeType)) {
                    continue;
                }
                collect(inline.getSelectionSet(), runtimeType, pushDown(inherited, inline.getDirectives()),
                    visitedFragments, fields);
            } else if (selection instanceof FragmentSpread spread) {
                if (!included(spread.getDirectives()) || !visitedFragments.add(spread.getName())) {
                    continue;
                }
                FragmentDefinition fragment = fragments.get(spread.getName());
                if (fragment == null) {
                    throw new PlanningException("Unknown fragment '" + spread.getName() + "'");
                }
                if (applies(fragment.getTypeCondition(), runtimeType)) {
                    collect(fragment.getSelectionSet(), runtimeType, pushDown(inherited, spread.getDirectives()),
                        visitedFragments, fields);
                }
                visitedFragments.remove(spread.getName());
            }
        }
    }

    private boolean applies(TypeName typeCondition, String runtimeType) {
        if (typeCondition == null || typeCondition.getName().equals(runtimeType)) {
            return true;
        }
        return schema.possibleTypes(typeCondition.getName()).contains(runtimeType);
    }

    private boolean included(List<Directive> directives) {
        if (variables == null) {
            return true;
        }
        for (Directive directive : directives) {
            if ("skip".equals(directive.getName()) && condition(directive)) {
                return false;
            }
            if ("include".equals(directive.getName()) && !condition(directive)) {
                return false;
            }
        }
        return true;
    }

    private boolean condition(Directive directive) {
        Argument argument = directive.getArgument("if");
        if (argument == null) {
            throw new PlanningException("Directive '@" + directive.getName() + "' requires an 'if' argument");
        }
        Value<?> value = argument.getValue();
        if (value instanceof BooleanValue bool) {
            return bool.isValue();
        }
        if (value instanceof VariableReference ref) {
            return Boolean.TRUE.equals(variables.get(ref.getName()));
        }
        throw new PlanningException("Argument 'if' of '@" + directive.getName() + "' must be a Boolean");
    }

    private List<Directive> pushDown(List<Directive> inherited, List<Directive> directives) {
        if (variables != null) {
            return inherited;
        }
        List<Directive> conditional = directives.stream()
            .filter(d -> CONDITIONAL_DIRECTIVES.contains(d.getName()))
            .toList();
        return conditional.isEmpty() ? inherited : concat(inherited, conditional);
    }

    private static List<Directive> concat(List<Directive> first, List<Directive> second) {
        List<Directive> result = new ArrayList<>(first);
        result.addAll(second);
        return result;
    }

    public static String responseKey(Field field) {
        return field.getAlias() != null ? field.getAlias() : field.getName();
    }
}
