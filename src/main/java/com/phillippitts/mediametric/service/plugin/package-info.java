/**
 * Computation plugins and the score-log contract they share with the pipeline.
 */
package com.phillippitts.mediametric.service.plugin;
