/**
 * A small hospital system built from agents: patient records, doctor rosters, appointment
 * booking, a secured patient registry, a streaming analysis agent and a coordinator that books
 * appointments across the first three.
 */
@NullMarked
package io.carelink.a2a.examples.hospital;

import org.jspecify.annotations.NullMarked;
