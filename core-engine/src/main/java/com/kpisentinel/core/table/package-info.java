/** Assembly of the forecast table. */
package com.kpisentinel.core.table;
