package com.questrail.conformance.rules.script;

import org.graalvm.polyglot.HostAccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only host object visible to code rules.
 */
public final class ScriptLogger
{
    private static final Logger log = LoggerFactory.getLogger("com.questrail.conformance.rules.script.code");

    @HostAccess.Export
    public void debug(String message) {
        log.debug(message);
    }

    @HostAccess.Export
    public void info(String message) {
        log.info(message);
    }

    @HostAccess.Export
    public void warn(String message) {
        log.warn(message);
    }

    @HostAccess.Export
    public void error(String message) {
        log.error(message);
    }
}
