package com.bazaarvoice.regroup.unmerge.api;

public interface UnmergeArgsVisitor<T> {

    T visit(InitialUnmergeArgs args);

    T visit(SuccessiveUnmergeArgs args);
}
