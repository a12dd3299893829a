/**
 * Command line entry points that run without the Spring application context.
 */
package com.phillippitts.sessionscribe.cli;
