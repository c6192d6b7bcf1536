/**
 * Producer-side contracts bridged to Reactive Streams by this library.
 */
package rsb.flow;
