/**
 * Transcode stage producer: turns arbitrary sources into raw planar workfiles.
 */
package com.phillippitts.mediametric.service.transcode;
