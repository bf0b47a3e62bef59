/**
 * Per-asset state machine, identity-keyed locking and batch scheduling.
 */
package com.phillippitts.mediametric.service.orchestration;
