package com.stewel.mining.assocrules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class AssociationRuleInMemoryRepository<T> implements AssociationRuleRepository<T> {

    private final List<AssociationRule<T>> associationRules = new ArrayList<>();

    @Override
    public List<AssociationRule<T>> findAll() {
        return Collections.unmodifiableList(associationRules);
    }

    @Override
    public void save(final AssociationRule<T> associationRule) {
        associationRules.add(associationRule);
    }

}
