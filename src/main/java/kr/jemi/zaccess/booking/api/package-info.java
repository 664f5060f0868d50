@NamedInterface("api")
package kr.jemi.zaccess.booking.api;

import org.springframework.modulith.NamedInterface;
