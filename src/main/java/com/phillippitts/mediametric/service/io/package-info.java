/**
 * Raw planar sample I/O over files and named pipes.
 */
package com.phillippitts.mediametric.service.io;
