/** Multi-step archive operations built on the DAO helpers and the archive façade. */
package com.bezdurakov.operations;
