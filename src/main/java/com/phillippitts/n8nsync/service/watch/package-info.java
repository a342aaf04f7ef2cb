/**
 * Observation side of the sync: the {@link com.phillippitts.n8nsync.service.watch.WorkflowWatcher},
 * its filesystem monitor, the three-way status rules and the per-id guard shared with the
 * engine.
 */
package com.phillippitts.n8nsync.service.watch;
