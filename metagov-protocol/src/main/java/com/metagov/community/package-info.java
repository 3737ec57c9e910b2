/** Community (tenant) model and its repository. */
package com.metagov.community;
