/**
 * External entity state lookup.
 */
package com.phillippitts.routineengine.service.state;
