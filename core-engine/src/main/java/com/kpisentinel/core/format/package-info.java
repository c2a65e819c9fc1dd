/** Type-aware rendering of the alerts table. */
package com.kpisentinel.core.format;
