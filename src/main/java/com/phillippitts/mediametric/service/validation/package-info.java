/**
 * Fail-fast asset validation.
 */
package com.phillippitts.mediametric.service.validation;
