/**
 * Engine services: staging, computation plugins, caching and orchestration.
 */
package com.phillippitts.mediametric.service;
