package com.piiguard.infrastructure.security;

/**
 * Permission strings in {@code resource.action} form.
 *
 * <p>Grants may also use the global wildcard {@link #ALL} or a resource wildcard such as
 * {@code employees.*}.
 */
public final class Permissions {

    public static final String ALL = "*";
    public static final String WILDCARD_SUFFIX = ".*";

    private Permissions() {
    }

    public static final class Employees {
        public static final String VIEW_ALL = "employees.view_all";
        public static final String VIEW_DEPARTMENT = "employees.view_department";
        public static final String VIEW_SELF = "employees.view_self";
        public static final String CREATE = "employees.create";
        public static final String UPDATE_ALL = "employees.update_all";
        public static final String UPDATE_DEPARTMENT = "employees.update_department";
        public static final String UPDATE_SELF_LIMITED = "employees.update_self_limited";
        public static final String DELETE = "employees.delete";
        public static final String EXPORT = "employees.export";
        public static final String EXPORT_DEPARTMENT = "employees.export_department";
        public static final String IMPORT = "employees.import";

        private Employees() {
        }
    }

    public static final class Departments {
        public static final String VIEW = "departments.view";
        public static final String VIEW_ALL = "departments.view_all";
        public static final String MANAGE = "departments.manage";
        public static final String CREATE = "departments.create";
        public static final String UPDATE = "departments.update";
        public static final String DELETE = "departments.delete";

        private Departments() {
        }
    }

    public static final class Reports {
        public static final String VIEW_ALL = "reports.view_all";
        public static final String VIEW_DEPARTMENT = "reports.view_department";
        public static final String EXPORT_ALL = "reports.export_all";
        public static final String EXPORT_DEPARTMENT = "reports.export_department";

        private Reports() {
        }
    }

    public static final class Users {
        public static final String MANAGE = "users.manage";
        public static final String CREATE = "users.create";
        public static final String UPDATE = "users.update";
        public static final String DELETE = "users.delete";
        public static final String VIEW_ALL = "users.view_all";
        public static final String ASSIGN_ROLE = "users.assign_role";
        public static final String ASSIGN_DEPARTMENT = "users.assign_department";

        private Users() {
        }
    }

    public static final class Onboarding {
        public static final String MANAGE = "onboarding.manage";
        public static final String CREATE = "onboarding.create";
        public static final String VIEW_ALL = "onboarding.view_all";
        public static final String UPDATE = "onboarding.update";
        public static final String SEND_NOTIFICATION = "onboarding.send_notification";

        private Onboarding() {
        }
    }
}
