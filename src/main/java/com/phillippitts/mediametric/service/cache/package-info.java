/**
 * Result caches keyed by asset and executor id.
 */
package com.phillippitts.mediametric.service.cache;
