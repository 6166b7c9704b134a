package io.toolhub.server.config;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import jakarta.inject.Qualifier;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/// Qualifies the executor that runs time-bounded calls against tool servers
/// (`tools/list` during discovery, `tools/call` during execution).
///
/// Kept apart from {@link ToolHubWorker} so a connect waiting on its own discovery call
/// never starves the pool it runs on.
@Qualifier
@Documented
@Retention(RUNTIME)
@Target({METHOD, FIELD, PARAMETER})
public @interface ToolCalls {}
