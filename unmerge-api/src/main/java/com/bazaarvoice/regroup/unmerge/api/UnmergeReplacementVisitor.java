package com.bazaarvoice.regroup.unmerge.api;

public interface UnmergeReplacementVisitor<T> {

    T visit(PrimaryHashUnmergeReplacement replacement);

    T visit(HierarchicalUnmergeReplacement replacement);
}
