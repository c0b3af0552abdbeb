package com.stewel.mining.assocrules;

import java.util.List;

public interface AssociationRuleRepository<T> {

    List<AssociationRule<T>> findAll();

    void save(AssociationRule<T> associationRule);

}
