package de.caluga.test.golden.data;

import de.caluga.golden.annotations.Id;

/**
 * holds a reference to another object that is not marked as relation
 */
public class Cauldron {
    @Id
    public Integer id;
    public Formula recipe;
}
