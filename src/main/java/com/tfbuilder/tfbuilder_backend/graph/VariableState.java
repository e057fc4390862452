package com.tfbuilder.tfbuilder_backend.graph;

import com.tfbuilder.tfbuilder_backend.model.domain.TerraformVariable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** Ordered variable set keyed by name. Adding an existing name is a no-op. */
public class VariableState {

    private final List<TerraformVariable> variables = new ArrayList<>();

    public List<TerraformVariable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    /** @return false when a variable with the same name already exists */
    public boolean addVariable(TerraformVariable variable) {
        if (getVariable(variable.name()).isPresent()) return false;
        variables.add(variable);
        return true;
    }

    public boolean removeVariable(String name) {
        return variables.removeIf(v -> v.name().equals(name));
    }

    /** Replaces the variable called {@code name}; does nothing when it is absent. */
    public boolean updateVariable(String name, TerraformVariable replacement) {
        for (int i = 0; i < variables.size(); i++) {
            if (variables.get(i).name().equals(name)) {
                variables.set(i, replacement);
                return true;
            }
        }
        return false;
    }

    public Optional<TerraformVariable> getVariable(String name) {
        return variables.stream().filter(v -> v.name().equals(name)).findFirst();
    }

    public void clearAll() {
        variables.clear();
    }

    public int size() {
        return variables.size();
    }
}
