/** Orchestration of a full evaluation run. */
package com.kpisentinel.core.engine;
