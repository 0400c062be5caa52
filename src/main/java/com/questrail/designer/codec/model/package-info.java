/**
 * Schema records of the runtime configuration text. These types carry no
 * behavior; property names and order are declared with Jackson annotations.
 */
package com.questrail.designer.codec.model;
