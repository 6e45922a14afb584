/**
 * Cross-cutting helpers: the logging facade and version lookup.
 */
package com.cs15.helpdesk.utils;
