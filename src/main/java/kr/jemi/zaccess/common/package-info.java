@ApplicationModule(type = ApplicationModule.Type.OPEN)
package kr.jemi.zaccess.common;

import org.springframework.modulith.ApplicationModule;
