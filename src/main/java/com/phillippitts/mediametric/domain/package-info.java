/**
 * Immutable value types describing assets, their streams and computation results.
 */
package com.phillippitts.mediametric.domain;
