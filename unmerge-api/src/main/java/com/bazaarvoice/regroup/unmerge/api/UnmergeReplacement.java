package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Immutable description of which events an unmerge moves out of the source group and how their destination groups
 * are keyed.  The replacement is created once per unmerge and carried verbatim by every page of the run, so the
 * serialized form always includes the "type" tag identifying the variant.
 */
@JsonTypeInfo (use=JsonTypeInfo.Id.NAME, include=JsonTypeInfo.As.PROPERTY, property="type")
@JsonSubTypes({
        @JsonSubTypes.Type(value=PrimaryHashUnmergeReplacement.class),
        @JsonSubTypes.Type(value=HierarchicalUnmergeReplacement.class)
})
public interface UnmergeReplacement {

    <T> T visit(UnmergeReplacementVisitor<T> visitor);
}
