/**
 * Small stateless helpers shared across the service layer: log sanitising, timing and id generation.
 */
package com.phillippitts.routineengine.util;
