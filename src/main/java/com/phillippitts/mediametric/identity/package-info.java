/**
 * Canonical identities of computation configurations and the run artifacts named after them.
 */
package com.phillippitts.mediametric.identity;
