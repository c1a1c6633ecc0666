/**
 * Domain pipelines, the concurrent orchestrator and the engine facade.
 */
package com.baselinesentinel.core.engine;
