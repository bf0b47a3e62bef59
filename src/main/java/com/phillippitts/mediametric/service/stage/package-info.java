/**
 * Intermediate stage planning and lifecycle: workfiles, procfiles and the named pipes
 * connecting them in streaming mode.
 */
package com.phillippitts.mediametric.service.stage;
