package com.questrail.conformance.action;

/**
 * The work an action performs. Runs on the harness action pool; an exception
 * fails only this action.
 */
@FunctionalInterface
public interface ActionHandler
{
    void execute(ActionInvocation invocation) throws Exception;
}
