/**
 * Spring configuration: typed properties, thread pools and bean wiring.
 */
package com.phillippitts.mediametric.config;
